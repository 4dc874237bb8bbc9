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

package org.kiln.passes;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.kiln.expr.BoolExpr;
import org.kiln.expr.BoolValueExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;

/**
 * A more thorough {@link Simplifier} that tries to remove as many conditionals as possible. In
 * addition to everything the basic simplifier does, it
 *
 * <ul>
 *   <li>replaces a conditional whose two branches are equal with that branch, regardless of the
 *       condition; and
 *   <li>folds boolean operators whose two operands are equal ({@code a && a}, {@code a || a},
 *       {@code a == a}, {@code a != a}).
 * </ul>
 *
 * Removing a conditional can make the value of a variable constant, and with it every reference to
 * that variable, so this is applied repeatedly until nothing changes (see {@link
 * Passes#eliminateSuperfluousConditionals}).
 */
final class ConditionalsSimplifier extends Simplifier {

  @Override
  protected Expr ifExpr(IfExpr e) {
    Expr result = super.ifExpr(e);
    if (result instanceof IfExpr simplified && simplified.yes.equals(simplified.no)) {
      return simplified.yes;
    }
    return result;
  }

  @Override
  @Nullable Expr fold(BoolExpr e, List<Expr> operands) {
    Expr result = super.fold(e, operands);
    if (result != null || e.operator == BoolExpr.Operator.NOT) {
      return result;
    }
    Expr left = operands.get(0);
    if (!left.equals(operands.get(1))) {
      return null;
    }
    return switch (e.operator) {
      case AND, OR -> left;
      case EQUAL -> new BoolValueExpr(true, e.pos);
      case NOT_EQUAL -> new BoolValueExpr(false, e.pos);
      case NOT -> throw new AssertionError();
    };
  }
}
