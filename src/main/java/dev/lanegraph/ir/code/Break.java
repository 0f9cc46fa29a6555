// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

/**
 * Transfers control to the enclosing {@link Block} or {@link Loop} with the given label. A break
 * to a block exits the block, a break to a loop continues with the next iteration.
 *
 * <p>A conditional break only transfers control if its condition is non-zero.
 */
public class Break extends Expression {

  private final String label;
  // Null for an unconditional break.
  private Expression condition;

  public Break(String label, Expression condition) {
    this.label = Objects.requireNonNull(label);
    this.condition = condition;
  }

  public String getLabel() {
    return label;
  }

  public boolean isConditional() {
    return condition != null;
  }

  public Expression getCondition() {
    return condition;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.BREAK;
  }

  @Override
  public int getNumberOfOperands() {
    return isConditional() ? 1 : 0;
  }

  @Override
  public Expression getOperand(int index) {
    return index == 0 && isConditional() ? condition : super.getOperand(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    if (index != 0 || !isConditional()) {
      super.setOperand(index, operand);
      return;
    }
    condition = Objects.requireNonNull(operand);
  }

  @Override
  public boolean isBreak() {
    return true;
  }

  @Override
  public Break asBreak() {
    return this;
  }

  @Override
  public String toString() {
    return (isConditional() ? "br_if $" : "br $") + label;
  }
}
