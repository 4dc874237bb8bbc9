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
import java.util.List;

/** Static helpers for working with expression trees. */
public final class Exprs {

  // Static methods only
  private Exprs() {}

  /**
   * Returns a tree equal to {@code e} in which every {@link PathExpr} is a fresh object. Other
   * nodes are immutable and are shared with {@code e} unless they have a path below them.
   *
   * <p>Use this whenever the same expression is stored in more than one place, since path
   * normalization modifies paths in place.
   */
  public static Expr copyPaths(Expr e) {
    return PATH_COPIER.visit(e);
  }

  /** Applies {@link #copyPaths} to each element of {@code exprs}. */
  public static ImmutableList<Expr> copyPaths(List<? extends Expr> exprs) {
    return exprs.stream().map(Exprs::copyPaths).collect(ImmutableList.toImmutableList());
  }

  /** Returns true if {@code e} is a literal or boolean value. */
  public static boolean isConstant(Expr e) {
    return e.kind() == Expr.Kind.LITERAL || e.kind() == Expr.Kind.BOOL_VALUE;
  }

  /**
   * Returns the string form of a constant: the text of a literal, or "true"/"false" for a boolean
   * value.
   */
  public static String constantText(Expr e) {
    if (e instanceof LiteralExpr literal) {
      return literal.value;
    } else if (e instanceof BoolValueExpr bool) {
      return bool.toString();
    }
    throw new IllegalArgumentException("not a constant: " + e);
  }

  private static final ExprRewriter PATH_COPIER =
      new ExprRewriter() {
        @Override
        protected Expr path(PathExpr e) {
          return new PathExpr(e.anchor(), visitAll(e.components()), e.pos);
        }
      };
}
