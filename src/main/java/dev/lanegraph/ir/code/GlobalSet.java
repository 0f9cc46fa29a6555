// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

public class GlobalSet extends Expression {

  private final int index;
  private Expression value;

  public GlobalSet(int index, Expression value) {
    this.index = index;
    this.value = Objects.requireNonNull(value);
  }

  public int getIndex() {
    return index;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.GLOBAL_SET;
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
  public boolean isGlobalSet() {
    return true;
  }

  @Override
  public GlobalSet asGlobalSet() {
    return this;
  }

  @Override
  public String toString() {
    return "global.set $g" + index;
  }
}
