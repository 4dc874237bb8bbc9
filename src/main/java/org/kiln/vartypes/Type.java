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

import com.google.errorprone.annotations.FormatMethod;
import org.kiln.TypeError;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Variable;

/**
 * The declared type of a variable. A Type has two jobs:
 *
 * <ul>
 *   <li>{@link #normalize} rewrites a value into the type's canonical form (e.g. a single value
 *       assigned to a list becomes a one-element list); and
 *   <li>{@link #validate} checks a normalized value, throwing a {@link TypeError} if it doesn't
 *       conform.
 * </ul>
 *
 * Some expression kinds are handled the same way by every type: null is always valid, a
 * conditional is valid if both of its branches are, and a reference is valid if the referenced
 * variable's value is (a reference to a property without a value is assumed to be valid). Only
 * the remaining kinds are passed to {@link #validateValue}.
 */
public abstract class Type {

  public final String name;

  protected Type(String name) {
    this.name = name;
  }

  /**
   * Returns {@code e} converted to this type's canonical form. Must return {@code e} itself if no
   * change is needed. The default implementation never changes anything.
   */
  public Expr normalize(Expr e) {
    return e;
  }

  /** Throws a TypeError if {@code e} is not a valid value of this type. */
  public final void validate(Expr e) {
    switch (e.kind()) {
      case NULL -> {}
      case IF -> {
        // The condition is checked separately, as a boolean subexpression.
        IfExpr ifExpr = (IfExpr) e;
        validate(ifExpr.yes);
        validate(ifExpr.no);
      }
      case REFERENCE -> {
        ReferenceExpr ref = (ReferenceExpr) e;
        Variable var = ref.resolve();
        if (var != null) {
          validateReferenced(var.value());
        }
      }
      default -> validateValue(e);
    }
  }

  /**
   * Checks the value of a variable referenced from a value of this type. The default requires it to
   * be a valid value of this type.
   */
  protected void validateReferenced(Expr value) {
    validate(value);
  }

  /** Checks a value that isn't null, a conditional, or a reference. */
  protected abstract void validateValue(Expr e);

  /** Returns a new TypeError for the given (offending) expression. */
  @FormatMethod
  protected final TypeError error(Expr e, String fmt, Object... fmtArgs) {
    return new TypeError(this, e, String.format(fmt, fmtArgs));
  }

  @Override
  public String toString() {
    return name;
  }
}
