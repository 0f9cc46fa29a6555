// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils.timing;

import dev.lanegraph.utils.AnalysisOptions;
import dev.lanegraph.utils.ThrowingAction;
import dev.lanegraph.utils.ThrowingSupplier;

/**
 * Times the phases of an analysis. {@link #empty()} is used when timings are not printed, so
 * callers can time phases unconditionally.
 */
public abstract class Timing implements AutoCloseable {

  public static Timing empty() {
    return TimingEmpty.getEmpty();
  }

  public static Timing create(String title, AnalysisOptions options) {
    if (options.printTimes) {
      return new TimingImpl(title, options.getOutput());
    }
    return Timing.empty();
  }

  public abstract Timing begin(String title);

  public abstract Timing end();

  public boolean isEmpty() {
    return false;
  }

  public abstract <E extends Exception> void time(String title, ThrowingAction<E> action) throws E;

  public abstract <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier)
      throws E;

  public abstract void report();

  // Remove throws from close() in AutoClosable to allow try with resources without explicit catch.
  @Override
  public final void close() {
    end();
  }
}
