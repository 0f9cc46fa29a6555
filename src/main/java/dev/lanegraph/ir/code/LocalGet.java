// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

/** Reads the local variable (or parameter) with the given index. */
public class LocalGet extends Expression {

  private final int index;

  public LocalGet(int index) {
    this.index = index;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.LOCAL_GET;
  }

  @Override
  public boolean isLocalGet() {
    return true;
  }

  @Override
  public LocalGet asLocalGet() {
    return this;
  }

  @Override
  public String toString() {
    return "local.get $" + index;
  }
}
