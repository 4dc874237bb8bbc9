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

package org.kiln;

import org.jspecify.annotations.Nullable;
import org.kiln.expr.Expr;
import org.kiln.vartypes.Type;

/**
 * Thrown when a (normalized) value doesn't conform to the declared type of the variable holding
 * it.
 *
 * <p>Types report errors without knowing which variable they are checking; the type validation
 * pass attaches the variable with {@link #forVariable}.
 */
public class TypeError extends KilnError {
  public final Type type;

  /** The offending subexpression. */
  public final Expr expr;

  /** The variable whose value was being checked, or null if not yet known. */
  public final @Nullable String varName;

  private final String detail;

  public TypeError(Type type, Expr expr, String detail) {
    this(type, expr, detail, null);
  }

  private TypeError(Type type, Expr expr, String detail, @Nullable String varName) {
    super(describe(type, detail, varName), expr.pos);
    this.type = type;
    this.expr = expr;
    this.detail = detail;
    this.varName = varName;
  }

  /** Returns a copy of this error that names the variable being checked. */
  public TypeError forVariable(String varName) {
    TypeError result = new TypeError(type, expr, detail, varName);
    result.setStackTrace(getStackTrace());
    return result;
  }

  private static String describe(Type type, String detail, @Nullable String varName) {
    if (varName == null) {
      return String.format("type error (%s): %s", type, detail);
    }
    return String.format("type error in variable \"%s\" (%s): %s", varName, type, detail);
  }
}
