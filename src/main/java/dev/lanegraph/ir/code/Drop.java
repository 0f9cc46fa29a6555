// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

public class Drop extends Expression {

  private Expression value;

  public Drop(Expression value) {
    this.value = Objects.requireNonNull(value);
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.DROP;
  }

  @Override
  public int getNumberOfOperands() {
    return 1;
  }

  @Override
  public Expression getOperand(int index) {
    return index == 0 ? value : super.getOperand(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    if (index != 0) {
      super.setOperand(index, operand);
      return;
    }
    value = Objects.requireNonNull(operand);
  }

  @Override
  public String toString() {
    return "drop";
  }
}
