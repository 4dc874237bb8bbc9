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

/**
 * A base class for bottom-up rewrites of expression trees. {@link #visit} returns the rewritten
 * expression; the original tree is never modified.
 *
 * <p>The default handlers return leaves and references unchanged. For composites (concat, list,
 * path, bool, if) the default visits each child and builds a new node of the same kind from the
 * results, but only if at least one child changed; if every child came back as the identical
 * object, the original node is returned. Callers rely on this to detect that a rewrite had no
 * effect by comparing identities.
 */
public abstract class ExprRewriter {

  public final Expr visit(Expr e) {
    return switch (e.kind()) {
      case LITERAL -> literal((LiteralExpr) e);
      case BOOL_VALUE -> boolValue((BoolValueExpr) e);
      case NULL -> nullValue((NullExpr) e);
      case REFERENCE -> reference((ReferenceExpr) e);
      case CONCAT -> concat((ConcatExpr) e);
      case LIST -> list((ListExpr) e);
      case PATH -> path((PathExpr) e);
      case BOOL -> bool((BoolExpr) e);
      case IF -> ifExpr((IfExpr) e);
    };
  }

  /**
   * Visits each of the given expressions. Returns {@code exprs} itself if no element changed,
   * otherwise a new list of the results.
   */
  protected final ImmutableList<Expr> visitAll(ImmutableList<Expr> exprs) {
    ImmutableList.Builder<Expr> builder = null;
    for (int i = 0; i < exprs.size(); i++) {
      Expr original = exprs.get(i);
      Expr result = visit(original);
      if (builder == null && result != original) {
        builder = ImmutableList.builderWithExpectedSize(exprs.size());
        builder.addAll(exprs.subList(0, i));
      }
      if (builder != null) {
        builder.add(result);
      }
    }
    return (builder == null) ? exprs : builder.build();
  }

  protected Expr literal(LiteralExpr e) {
    return e;
  }

  protected Expr boolValue(BoolValueExpr e) {
    return e;
  }

  protected Expr nullValue(NullExpr e) {
    return e;
  }

  protected Expr reference(ReferenceExpr e) {
    return e;
  }

  protected Expr concat(ConcatExpr e) {
    ImmutableList<Expr> items = visitAll(e.items);
    return (items == e.items) ? e : new ConcatExpr(items, e.pos);
  }

  protected Expr list(ListExpr e) {
    ImmutableList<Expr> items = visitAll(e.items);
    return (items == e.items) ? e : new ListExpr(items, e.pos);
  }

  protected Expr path(PathExpr e) {
    ImmutableList<Expr> components = visitAll(e.components());
    return (components == e.components()) ? e : new PathExpr(e.anchor(), components, e.pos);
  }

  protected Expr bool(BoolExpr e) {
    ImmutableList<Expr> operands = visitAll(e.operands);
    return (operands == e.operands) ? e : new BoolExpr(e.operator, operands, e.pos);
  }

  protected Expr ifExpr(IfExpr e) {
    Expr cond = visit(e.cond);
    Expr yes = visit(e.yes);
    Expr no = visit(e.no);
    if (cond == e.cond && yes == e.yes && no == e.no) {
      return e;
    }
    return new IfExpr(cond, yes, no, e.pos);
  }
}
