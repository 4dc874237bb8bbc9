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

/**
 * The value of a variable is a tree of Exprs. There is a fixed set of node kinds, listed in {@link
 * Kind}; each has a corresponding final subclass.
 *
 * <p>Exprs are owned by the Variable that holds them. Passes that transform an expression build a
 * new tree (see {@link ExprRewriter}) and store it back in the Variable, with the single exception
 * of {@link PathExpr}, whose anchor and components are rewritten in place by path normalization.
 *
 * <p>{@link #equals} and {@link #hashCode} compare structure and ignore source positions.
 */
public abstract class Expr {

  /** The kinds of expression node. */
  public enum Kind {
    LITERAL,
    BOOL_VALUE,
    NULL,
    REFERENCE,
    CONCAT,
    LIST,
    PATH,
    BOOL,
    IF
  }

  /** Where this expression was defined, or null if it was synthesized. */
  public final @Nullable Position pos;

  Expr(@Nullable Position pos) {
    this.pos = pos;
  }

  public abstract Kind kind();

  /**
   * Returns the direct subexpressions of this node, in order. Leaves and references have none (the
   * value a reference points to is not part of this tree).
   */
  public abstract ImmutableList<Expr> children();

  /** Returns true if this is a literal, boolean value, or null. */
  public boolean isLeaf() {
    return switch (kind()) {
      case LITERAL, BOOL_VALUE, NULL -> true;
      default -> false;
    };
  }
}
