// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Call extends Expression {

  private final String target;
  private final List<Expression> operands;

  public Call(String target, List<Expression> operands) {
    this.target = Objects.requireNonNull(target);
    this.operands = new ArrayList<>(operands);
  }

  public String getTarget() {
    return target;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.CALL;
  }

  @Override
  public int getNumberOfOperands() {
    return operands.size();
  }

  @Override
  public Expression getOperand(int index) {
    return operands.get(index);
  }

  @Override
  public void setOperand(int index, Expression operand) {
    operands.set(index, Objects.requireNonNull(operand));
  }

  @Override
  public boolean isCall() {
    return true;
  }

  @Override
  public Call asCall() {
    return this;
  }

  @Override
  public String toString() {
    return "call $" + target;
  }
}
