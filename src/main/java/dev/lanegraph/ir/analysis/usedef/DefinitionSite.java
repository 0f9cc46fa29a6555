// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import java.util.Objects;

/**
 * A definition expression together with the lane it writes.
 *
 * <p>Two sites are equal if they wrap the same definition expression and lane, so the sites
 * created by separate analyses of the same function compare equal.
 */
public final class DefinitionSite<D extends Expression> extends ReachingDefinition<D> {

  private final D definition;
  private final int lane;

  DefinitionSite(D definition, int lane) {
    this.definition = definition;
    this.lane = lane;
  }

  public D getDefinition() {
    return definition;
  }

  public int getLane() {
    return lane;
  }

  @Override
  public boolean isDefinitionSite() {
    return true;
  }

  @Override
  public DefinitionSite<D> asDefinitionSite() {
    return this;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DefinitionSite)) {
      return false;
    }
    DefinitionSite<?> site = (DefinitionSite<?>) other;
    return definition == site.definition && lane == site.lane;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(definition), lane);
  }

  @Override
  public String toString() {
    return definition.toString();
  }
}
