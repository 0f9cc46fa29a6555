// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

/**
 * Executes its body once. A {@link Break} to the loop's label jumps back to the start of the body.
 */
public class Loop extends Expression {

  private final String label;
  private Expression body;

  public Loop(String label, Expression body) {
    this.label = Objects.requireNonNull(label);
    this.body = Objects.requireNonNull(body);
  }

  public String getLabel() {
    return label;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.LOOP;
  }

  @Override
  public int getNumberOfOperands() {
    return 1;
  }

  @Override
  public Expression getOperand(int index) {
    return index == 0 ? body : super.getOperand(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    if (index != 0) {
      super.setOperand(index, operand);
      return;
    }
    body = Objects.requireNonNull(operand);
  }

  @Override
  public boolean isLoop() {
    return true;
  }

  @Override
  public Loop asLoop() {
    return this;
  }

  @Override
  public String toString() {
    return "loop $" + label;
  }
}
