// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public class Nop extends Expression {

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.NOP;
  }

  @Override
  public String toString() {
    return "nop";
  }
}
