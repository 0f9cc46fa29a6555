// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A sequence of expressions. A labeled block can be exited early with a {@link Break}. */
public class Block extends Expression {

  // Null if no break can target this block.
  private final String label;
  private final List<Expression> children;

  public Block(String label, List<Expression> children) {
    this.label = label;
    this.children = new ArrayList<>(children);
  }

  public boolean hasLabel() {
    return label != null;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.BLOCK;
  }

  @Override
  public int getNumberOfOperands() {
    return children.size();
  }

  @Override
  public Expression getOperand(int index) {
    return children.get(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    children.set(index, Objects.requireNonNull(operand));
  }

  @Override
  public boolean isBlock() {
    return true;
  }

  @Override
  public Block asBlock() {
    return this;
  }

  @Override
  public String toString() {
    return hasLabel() ? "block $" + label : "block";
  }
}
