// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.utils.timing;

import dev.lanegraph.utils.ThrowingAction;
import dev.lanegraph.utils.ThrowingSupplier;

class TimingEmpty extends Timing {

  private static final TimingEmpty INSTANCE = new TimingEmpty();

  static Timing getEmpty() {
    return INSTANCE;
  }

  private TimingEmpty() {}

  @Override
  public Timing begin(String title) {
    return this;
  }

  @Override
  public Timing end() {
    return this;
  }

  @Override
  public boolean isEmpty() {
    return true;
  }

  @Override
  public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
    action.execute();
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    return supplier.get();
  }

  @Override
  public void report() {}
}
