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

/**
 * A base class for passes that walk an expression tree without changing its shape (checks,
 * collectors, and the in-place rewriting of {@link PathExpr} anchors).
 *
 * <p>{@link #visit} dispatches on the node's {@link Expr.Kind}. The default handlers are:
 *
 * <ul>
 *   <li>leaves (literal, boolean value, null): do nothing;
 *   <li>references: do nothing, since the referenced variable's value is not part of this tree;
 *       subclasses that follow references must override {@link #reference};
 *   <li>composites (concat, list, path, bool, if): visit each child in order.
 * </ul>
 */
public abstract class ExprScanner {

  public final void visit(Expr e) {
    switch (e.kind()) {
      case LITERAL -> literal((LiteralExpr) e);
      case BOOL_VALUE -> boolValue((BoolValueExpr) e);
      case NULL -> nullValue((NullExpr) e);
      case REFERENCE -> reference((ReferenceExpr) e);
      case CONCAT -> concat((ConcatExpr) e);
      case LIST -> list((ListExpr) e);
      case PATH -> path((PathExpr) e);
      case BOOL -> bool((BoolExpr) e);
      case IF -> ifExpr((IfExpr) e);
    }
  }

  /** Visits each of the given expressions. */
  public final void visitAll(Iterable<? extends Expr> exprs) {
    exprs.forEach(this::visit);
  }

  /** Visits each direct child of {@code e}. */
  protected final void visitChildren(Expr e) {
    visitAll(e.children());
  }

  protected void literal(LiteralExpr e) {}

  protected void boolValue(BoolValueExpr e) {}

  protected void nullValue(NullExpr e) {}

  protected void reference(ReferenceExpr e) {}

  protected void concat(ConcatExpr e) {
    visitChildren(e);
  }

  protected void list(ListExpr e) {
    visitChildren(e);
  }

  protected void path(PathExpr e) {
    visitChildren(e);
  }

  protected void bool(BoolExpr e) {
    visitChildren(e);
  }

  protected void ifExpr(IfExpr e) {
    visitChildren(e);
  }
}
