// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

public class If extends Expression {

  private Expression condition;
  private Expression ifTrue;
  // Null if there is no else arm.
  private Expression ifFalse;

  public If(Expression condition, Expression ifTrue, Expression ifFalse) {
    this.condition = Objects.requireNonNull(condition);
    this.ifTrue = Objects.requireNonNull(ifTrue);
    this.ifFalse = ifFalse;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getIfTrue() {
    return ifTrue;
  }

  public boolean hasIfFalse() {
    return ifFalse != null;
  }

  public Expression getIfFalse() {
    return ifFalse;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.IF;
  }

  @Override
  public int getNumberOfOperands() {
    return hasIfFalse() ? 3 : 2;
  }

  @Override
  public Expression getOperand(int index) {
    switch (index) {
      case 0:
        return condition;
      case 1:
        return ifTrue;
      case 2:
        if (hasIfFalse()) {
          return ifFalse;
        }
        // Fall through.
      default:
        return super.getOperand(index);
    }
  }

  @Override
  public void setOperand(int index, Expression operand) {
    Objects.requireNonNull(operand);
    switch (index) {
      case 0:
        condition = operand;
        break;
      case 1:
        ifTrue = operand;
        break;
      case 2:
        if (hasIfFalse()) {
          ifFalse = operand;
          break;
        }
        // Fall through.
      default:
        super.setOperand(index, operand);
    }
  }

  @Override
  public boolean isIf() {
    return true;
  }

  @Override
  public If asIf() {
    return this;
  }

  @Override
  public String toString() {
    return "if";
  }
}
