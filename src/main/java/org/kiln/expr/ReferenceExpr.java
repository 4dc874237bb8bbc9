/*
 * Copyright 2025 The Kiln Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kiln.expr;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.kiln.model.ModelPart;
import org.kiln.model.Variable;

/**
 * A reference to a variable, written {@code $(name)}. The variable is looked up lexically starting
 * from {@link #context}, the module or target in which the reference was written.
 */
public final class ReferenceExpr extends Expr {
  public final String var;
  public final ModelPart context;

  public ReferenceExpr(String var, ModelPart context, @Nullable Position pos) {
    super(pos);
    this.var = var;
    this.context = context;
  }

  public ReferenceExpr(String var, ModelPart context) {
    this(var, context, null);
  }

  /**
   * Returns the referenced variable, or null if there is none. A reference to a property that was
   * never explicitly set has no variable; it stands for the property's default.
   */
  public @Nullable Variable resolve() {
    return context.getVariable(var);
  }

  @Override
  public Kind kind() {
    return Kind.REFERENCE;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ReferenceExpr other && var.equals(other.var) && context == other.context;
  }

  @Override
  public int hashCode() {
    return 31 * var.hashCode() + System.identityHashCode(context);
  }

  @Override
  public String toString() {
    return "$(" + var + ")";
  }
}
