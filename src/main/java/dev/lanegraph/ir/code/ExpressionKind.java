// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public enum ExpressionKind {
  BINARY,
  BLOCK,
  BREAK,
  CALL,
  CONST,
  DROP,
  GLOBAL_GET,
  GLOBAL_SET,
  IF,
  LOCAL_GET,
  LOCAL_SET,
  LOOP,
  NOP,
  RETURN,
  SWITCH,
  TRAP;

  /** Returns true if control never falls through an expression of this kind. */
  public boolean isUnconditionalTransfer() {
    return this == RETURN || this == SWITCH || this == TRAP;
  }
}
