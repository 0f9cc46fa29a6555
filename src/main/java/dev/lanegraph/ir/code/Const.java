// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public class Const extends Expression {

  private final ValueType type;
  private final long value;

  public Const(ValueType type, long value) {
    this.type = type;
    this.value = value;
  }

  public ValueType getType() {
    return type;
  }

  public long getValue() {
    return value;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.CONST;
  }

  @Override
  public boolean isConst() {
    return true;
  }

  @Override
  public Const asConst() {
    return this;
  }

  @Override
  public String toString() {
    return type + ".const " + value;
  }
}
