// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

public class Return extends Expression {

  // Null for a void return.
  private Expression value;

  public Return(Expression value) {
    this.value = value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.RETURN;
  }

  @Override
  public int getNumberOfOperands() {
    return hasValue() ? 1 : 0;
  }

  @Override
  public Expression getOperand(int index) {
    return index == 0 && hasValue() ? value : super.getOperand(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    if (index != 0 || !hasValue()) {
      super.setOperand(index, operand);
      return;
    }
    value = Objects.requireNonNull(operand);
  }

  @Override
  public boolean isReturn() {
    return true;
  }

  @Override
  public Return asReturn() {
    return this;
  }

  @Override
  public String toString() {
    return "return";
  }
}
