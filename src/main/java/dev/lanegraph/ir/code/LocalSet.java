// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import java.util.Objects;

/**
 * Writes the local variable (or parameter) with the given index. A tee additionally produces the
 * written value.
 */
public class LocalSet extends Expression {

  private final int index;
  private final boolean tee;
  private Expression value;

  public LocalSet(int index, Expression value, boolean tee) {
    this.index = index;
    this.value = Objects.requireNonNull(value);
    this.tee = tee;
  }

  public int getIndex() {
    return index;
  }

  public Expression getValue() {
    return value;
  }

  public boolean isTee() {
    return tee;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.LOCAL_SET;
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
  public boolean isLocalSet() {
    return true;
  }

  @Override
  public LocalSet asLocalSet() {
    return this;
  }

  @Override
  public String toString() {
    return (tee ? "local.tee $" : "local.set $") + index;
  }
}
