// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;

/**
 * A value source that may reach a use: either an explicit definition ({@link DefinitionSite}) or
 * the value the lane holds on function entry ({@link EntryValue}).
 */
public abstract class ReachingDefinition<D extends Expression> {

  ReachingDefinition() {}

  public boolean isDefinitionSite() {
    return false;
  }

  public DefinitionSite<D> asDefinitionSite() {
    return null;
  }

  public boolean isEntryValue() {
    return false;
  }

  public EntryValue<D> asEntryValue() {
    return null;
  }
}
