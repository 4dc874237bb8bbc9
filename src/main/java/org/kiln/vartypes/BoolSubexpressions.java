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

import com.google.common.collect.ImmutableList;
import org.kiln.expr.BoolExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.ExprRewriter;
import org.kiln.expr.IfExpr;

/**
 * Normalizes and validates the parts of an expression that are used as conditions: the condition
 * of every {@link IfExpr}, and the operands of the logical operators (AND, OR, NOT). Operands of
 * EQUAL and NOT_EQUAL are compared as plain values and left alone.
 *
 * <p>This must run before a variable's value is normalized according to its declared type, so
 * that e.g. the "true" in {@code $(true ? a : b)} becomes a boolean rather than being coerced
 * into an item of a list.
 */
public final class BoolSubexpressions extends ExprRewriter {

  private static final BoolSubexpressions INSTANCE = new BoolSubexpressions();

  private BoolSubexpressions() {}

  /**
   * Returns {@code e} with all boolean subexpressions normalized; throws a TypeError if one of them
   * isn't a valid boolean. Returns {@code e} itself if nothing needed to change.
   */
  public static Expr normalizeAndValidate(Expr e) {
    return INSTANCE.visit(e);
  }

  @Override
  protected Expr ifExpr(IfExpr e) {
    Expr cond = asCondition(visit(e.cond));
    Expr yes = visit(e.yes);
    Expr no = visit(e.no);
    if (cond == e.cond && yes == e.yes && no == e.no) {
      return e;
    }
    return new IfExpr(cond, yes, no, e.pos);
  }

  @Override
  protected Expr bool(BoolExpr e) {
    ImmutableList<Expr> operands = visitAll(e.operands);
    if (e.operator.hasBoolOperands()) {
      operands =
          operands.stream()
              .map(BoolSubexpressions::asCondition)
              .collect(ImmutableList.toImmutableList());
    }
    for (int i = 0; i < operands.size(); i++) {
      if (operands.get(i) != e.operands.get(i)) {
        return new BoolExpr(e.operator, operands, e.pos);
      }
    }
    return e;
  }

  private static Expr asCondition(Expr e) {
    Expr result = BoolType.INSTANCE.normalize(e);
    BoolType.INSTANCE.validate(result);
    return result;
  }
}
