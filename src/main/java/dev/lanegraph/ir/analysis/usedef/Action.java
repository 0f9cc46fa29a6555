// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.analysis.usedef;

import dev.lanegraph.ir.code.Expression;

/** A classified use or definition recorded in a {@link BasicBlock}, in program order. */
public abstract class Action<U extends Expression, D extends Expression> {

  private final int lane;

  private Action(int lane) {
    this.lane = lane;
  }

  static <U extends Expression, D extends Expression> UseAction<U, D> use(U use, int lane) {
    return new UseAction<>(use, lane);
  }

  static <U extends Expression, D extends Expression> DefAction<U, D> def(
      DefinitionSite<D> definitionSite) {
    return new DefAction<>(definitionSite);
  }

  public int getLane() {
    return lane;
  }

  public abstract Expression getExpression();

  public boolean isUse() {
    return false;
  }

  public UseAction<U, D> asUse() {
    return null;
  }

  public boolean isDef() {
    return false;
  }

  public DefAction<U, D> asDef() {
    return null;
  }

  public static final class UseAction<U extends Expression, D extends Expression>
      extends Action<U, D> {

    private final U use;

    private UseAction(U use, int lane) {
      super(lane);
      this.use = use;
    }

    public U getUse() {
      return use;
    }

    @Override
    public Expression getExpression() {
      return use;
    }

    @Override
    public boolean isUse() {
      return true;
    }

    @Override
    public UseAction<U, D> asUse() {
      return this;
    }

    @Override
    public String toString() {
      return "use " + use;
    }
  }

  public static final class DefAction<U extends Expression, D extends Expression>
      extends Action<U, D> {

    private final DefinitionSite<D> definitionSite;

    private DefAction(DefinitionSite<D> definitionSite) {
      super(definitionSite.getLane());
      this.definitionSite = definitionSite;
    }

    public DefinitionSite<D> getDefinitionSite() {
      return definitionSite;
    }

    @Override
    public Expression getExpression() {
      return definitionSite.getDefinition();
    }

    @Override
    public boolean isDef() {
      return true;
    }

    @Override
    public DefAction<U, D> asDef() {
      return this;
    }

    @Override
    public String toString() {
      return "def " + definitionSite;
    }
  }
}
