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

package org.kiln.model;

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;
import org.kiln.expr.Expr;
import org.kiln.expr.Position;
import org.kiln.vartypes.Type;

/**
 * A named, typed variable whose value is an expression tree. The value is replaced (never the
 * variable itself) as the passes normalize and simplify the model.
 *
 * <p>Variables are compared by identity.
 */
public final class Variable {
  public final String name;
  public final Type type;

  /**
   * True if this variable holds the value of a property, i.e. a variable with toolset-defined
   * meaning. Properties are consumed by the toolset rather than referenced from other expressions.
   */
  public final boolean isProperty;

  /** Where the variable was defined, taken from its initial value. */
  public final @Nullable Position pos;

  private Expr value;

  public Variable(String name, Expr value, Type type, boolean isProperty) {
    this.name = checkNotNull(name);
    this.value = checkNotNull(value);
    this.type = checkNotNull(type);
    this.isProperty = isProperty;
    this.pos = value.pos;
  }

  /** Creates a free-form (non-property) variable. */
  public Variable(String name, Expr value, Type type) {
    this(name, value, type, false);
  }

  /** Creates a variable holding a value for the given property. */
  public static Variable fromProperty(Property prop, Expr value) {
    return new Variable(prop.name, value, prop.type, true);
  }

  public Expr value() {
    return value;
  }

  public void setValue(Expr value) {
    this.value = checkNotNull(value);
  }

  @Override
  public String toString() {
    return name + " = " + value;
  }
}
