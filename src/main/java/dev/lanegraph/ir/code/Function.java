// Copyright (c) 2026, the Lanegraph project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package dev.lanegraph.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * A function with a structured body.
 *
 * <p>Locals are numbered with the parameters first: indices {@code [0, getNumberOfParams())} are
 * parameters, the remaining indices up to {@link #getNumberOfLocals()} are declared variables.
 * Parameters hold the argument value on entry, variables hold the zero value of their type.
 */
public class Function {

  private final String name;
  private final ImmutableList<ValueType> params;
  private final ImmutableList<ValueType> vars;
  private Expression body;

  private Function(
      String name,
      ImmutableList<ValueType> params,
      ImmutableList<ValueType> vars,
      Expression body) {
    this.name = name;
    this.params = params;
    this.vars = vars;
    this.body = body;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public Expression getBody() {
    return body;
  }

  public void setBody(Expression body) {
    this.body = Objects.requireNonNull(body);
  }

  public int getNumberOfParams() {
    return params.size();
  }

  public int getNumberOfVars() {
    return vars.size();
  }

  public int getNumberOfLocals() {
    return params.size() + vars.size();
  }

  public boolean isParam(int index) {
    assert index >= 0 && index < getNumberOfLocals() : "Invalid local index " + index;
    return index < params.size();
  }

  public boolean isVar(int index) {
    return !isParam(index);
  }

  public ValueType getLocalType(int index) {
    return isParam(index) ? params.get(index) : vars.get(index - params.size());
  }

  @Override
  public String toString() {
    return "func $" + name;
  }

  public static class Builder {

    private final String name;
    private final ImmutableList.Builder<ValueType> params = ImmutableList.builder();
    private final ImmutableList.Builder<ValueType> vars = ImmutableList.builder();
    private Expression body;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name);
    }

    public Builder addParam(ValueType type) {
      params.add(type);
      return this;
    }

    public Builder addParams(ValueType... types) {
      params.add(types);
      return this;
    }

    public Builder addVar(ValueType type) {
      vars.add(type);
      return this;
    }

    public Builder addVars(ValueType... types) {
      vars.add(types);
      return this;
    }

    public Builder setBody(Expression body) {
      this.body = body;
      return this;
    }

    public Function build() {
      return new Function(
          name, params.build(), vars.build(), body != null ? body : ExpressionBuilder.makeNop());
    }
  }
}
