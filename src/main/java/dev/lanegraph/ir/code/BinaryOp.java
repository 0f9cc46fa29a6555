// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public enum BinaryOp {
  ADD("add"),
  SUB("sub"),
  MUL("mul"),
  EQ("eq"),
  NE("ne"),
  LT("lt_s"),
  GT("gt_s");

  private final String symbol;

  BinaryOp(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
