// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;
import it.unimi.dsi.fastutil.objects.Reference2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ReferenceLinkedOpenHashSet;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Relations derived from a use-def map that tell whether rewriting a definition affects other
 * code:
 *
 * <ul>
 *   <li>the uses nested inside the value written by a definition, and the reverse relation;
 *   <li>the uses that a definition reaches.
 * </ul>
 */
public class InfluenceIndex<U extends Expression, D extends Expression> {

  private final Map<D, Set<U>> nestedUses = new Reference2ObjectLinkedOpenHashMap<>();
  private final Map<U, Set<D>> enclosingDefinitions = new Reference2ObjectLinkedOpenHashMap<>();
  private final Map<D, Set<U>> reachedUses = new Reference2ObjectLinkedOpenHashMap<>();

  private InfluenceIndex() {}

  static <U extends Expression, D extends Expression> InfluenceIndex<U, D> compute(
      UseDefClassifier<U, D> classifier,
      Map<Expression, ExpressionLocation> locations,
      Map<U, Set<ReachingDefinition<D>>> useDefinitions) {
    InfluenceIndex<U, D> index = new InfluenceIndex<>();
    for (Expression expression : locations.keySet()) {
      D def = classifier.asDefOrNull(expression);
      if (def != null) {
        classifier
            .getDefValue(def)
            .forEachNested(
                nested -> {
                  U use = classifier.asUseOrNull(nested);
                  // Uses in unreachable parts of the value have no location.
                  if (use != null && locations.containsKey(use)) {
                    add(index.nestedUses, def, use);
                    add(index.enclosingDefinitions, use, def);
                  }
                });
      } else {
        U use = classifier.asUseOrNull(expression);
        assert use != null;
        for (ReachingDefinition<D> definition :
            useDefinitions.getOrDefault(use, Collections.emptySet())) {
          if (definition.isDefinitionSite()) {
            add(index.reachedUses, definition.asDefinitionSite().getDefinition(), use);
          }
        }
      }
    }
    return index;
  }

  private static <K, V> void add(Map<K, Set<V>> map, K key, V value) {
    Set<V> values = map.get(key);
    if (values == null) {
      values = new ReferenceLinkedOpenHashSet<>();
      map.put(key, values);
    }
    values.add(value);
  }

  /** Returns the uses nested inside the value written by {@code def}. */
  public Set<U> getNestedUses(D def) {
    return unmodifiableOrEmpty(nestedUses.get(def));
  }

  /** Returns the definitions whose written value contains {@code use}. */
  public Set<D> getEnclosingDefinitions(U use) {
    return unmodifiableOrEmpty(enclosingDefinitions.get(use));
  }

  /** Returns the uses that {@code def} reaches. */
  public Set<U> getReachedUses(D def) {
    return unmodifiableOrEmpty(reachedUses.get(def));
  }

  private static <T> Set<T> unmodifiableOrEmpty(Set<T> set) {
    return set != null ? Collections.unmodifiableSet(set) : Collections.emptySet();
  }
}
