// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils;

@FunctionalInterface
public interface ThrowingSupplier<T, E extends Throwable> {

  T get() throws E;
}
