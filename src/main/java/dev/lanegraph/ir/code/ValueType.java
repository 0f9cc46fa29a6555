// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

public enum ValueType {
  I32("i32"),
  I64("i64"),
  F32("f32"),
  F64("f64");

  private final String name;

  ValueType(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
