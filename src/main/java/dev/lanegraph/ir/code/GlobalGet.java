// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public class GlobalGet extends Expression {

  private final int index;

  public GlobalGet(int index) {
    this.index = index;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.GLOBAL_GET;
  }

  @Override
  public boolean isGlobalGet() {
    return true;
  }

  @Override
  public GlobalGet asGlobalGet() {
    return this;
  }

  @Override
  public String toString() {
    return "global.get $g" + index;
  }
}
