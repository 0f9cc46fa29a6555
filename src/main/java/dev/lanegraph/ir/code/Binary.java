// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

public class Binary extends Expression {

  private final BinaryOp op;
  private Expression left;
  private Expression right;

  public Binary(BinaryOp op, Expression left, Expression right) {
    this.op = op;
    this.left = Objects.requireNonNull(left);
    this.right = Objects.requireNonNull(right);
  }

  public BinaryOp getOp() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.BINARY;
  }

  @Override
  public int getNumberOfOperands() {
    return 2;
  }

  @Override
  public Expression getOperand(int index) {
    switch (index) {
      case 0:
        return left;
      case 1:
        return right;
      default:
        return super.getOperand(index);
    }
  }

  @Override
  public void setOperand(int index, Expression operand) {
    switch (index) {
      case 0:
        left = Objects.requireNonNull(operand);
        break;
      case 1:
        right = Objects.requireNonNull(operand);
        break;
      default:
        super.setOperand(index, operand);
    }
  }

  @Override
  public boolean isBinary() {
    return true;
  }

  @Override
  public Binary asBinary() {
    return this;
  }

  @Override
  public String toString() {
    return op.getSymbol();
  }
}
