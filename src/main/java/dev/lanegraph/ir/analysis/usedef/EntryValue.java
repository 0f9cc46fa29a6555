// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;

/**
 * The value a lane holds on function entry: the argument for a parameter, the default value for
 * any other slot.
 */
public final class EntryValue<D extends Expression> extends ReachingDefinition<D> {

  private static final EntryValue<?> INSTANCE = new EntryValue<>();

  private EntryValue() {}

  @SuppressWarnings("unchecked")
  public static <D extends Expression> EntryValue<D> get() {
    return (EntryValue<D>) INSTANCE;
  }

  @Override
  public boolean isEntryValue() {
    return true;
  }

  @Override
  public EntryValue<D> asEntryValue() {
    return this;
  }

  @Override
  public String toString() {
    return "<entry value>";
  }
}
