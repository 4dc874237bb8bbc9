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

package org.kiln.vartypes;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import org.kiln.expr.Expr;
import org.kiln.expr.LiteralExpr;

/** A string restricted to a fixed set of values. */
public final class EnumType extends Type {
  public final ImmutableSet<String> allowedValues;

  public EnumType(String name, String... allowedValues) {
    super(name);
    this.allowedValues = ImmutableSet.copyOf(allowedValues);
  }

  @Override
  protected void validateValue(Expr e) {
    if (!(e instanceof LiteralExpr literal)) {
      throw error(e, "%s is not a constant %s value", e, name);
    }
    if (!allowedValues.contains(literal.value)) {
      throw error(
          e,
          "\"%s\" is not a valid %s value (allowed: %s)",
          literal.value,
          name,
          Joiner.on(", ").join(allowedValues));
    }
  }
}
