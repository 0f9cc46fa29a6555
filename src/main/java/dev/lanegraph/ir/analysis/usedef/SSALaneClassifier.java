// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

/**
 * Finds the lanes in single static assignment form: lanes with exactly one definition site in the
 * function whose value is the only value seen by every use of the lane. A lane that is never
 * written, and only ever reads its entry value, also qualifies.
 *
 * <p>The definition sites are counted textually, so a definition that is always overwritten before
 * being read still disqualifies its lane.
 */
class SSALaneClassifier {

  static <U extends Expression, D extends Expression> IntSet compute(
      UseDefClassifier<U, D> classifier,
      Map<Expression, ExpressionLocation> locations,
      Map<U, Set<ReachingDefinition<D>>> useDefinitions) {
    // The distinct definitions that reach the uses of each lane.
    Int2ReferenceMap<Set<ReachingDefinition<D>>> laneDefinitions =
        new Int2ReferenceOpenHashMap<>();
    for (Entry<U, Set<ReachingDefinition<D>>> entry : useDefinitions.entrySet()) {
      int lane = classifier.getUseLane(entry.getKey());
      Set<ReachingDefinition<D>> definitions = laneDefinitions.get(lane);
      if (definitions == null) {
        definitions = new ObjectLinkedOpenHashSet<>();
        laneDefinitions.put(lane, definitions);
      }
      definitions.addAll(entry.getValue());
    }
    for (Expression expression : locations.keySet()) {
      D def = classifier.asDefOrNull(expression);
      if (def == null) {
        continue;
      }
      Set<ReachingDefinition<D>> definitions = laneDefinitions.get(classifier.getDefLane(def));
      if (definitions != null
          && definitions.size() == 1
          && !isDefinitionOf(definitions.iterator().next(), def)) {
        // The lane has a single reaching definition, but it is not this one.
        definitions.clear();
      }
    }
    IntSet ssaLanes = new IntOpenHashSet();
    for (Int2ReferenceMap.Entry<Set<ReachingDefinition<D>>> entry :
        laneDefinitions.int2ReferenceEntrySet()) {
      if (entry.getValue().size() == 1) {
        ssaLanes.add(entry.getIntKey());
      }
    }
    return IntSets.unmodifiable(ssaLanes);
  }

  private static <D extends Expression> boolean isDefinitionOf(
      ReachingDefinition<D> definition, D def) {
    return definition.isDefinitionSite() && definition.asDefinitionSite().getDefinition() == def;
  }
}
