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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.kiln.expr.BoolExpr;
import org.kiln.expr.BoolValueExpr;
import org.kiln.expr.ConcatExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.ExprRewriter;
import org.kiln.expr.Exprs;
import org.kiln.expr.IfExpr;
import org.kiln.expr.LiteralExpr;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Variable;

/**
 * Performs cheap simplifications of expressions:
 *
 * <ul>
 *   <li>adjacent literals in a concatenation are merged, nested concatenations are flattened, and
 *       empty literals are dropped;
 *   <li>a reference to a variable whose (simplified) value is a literal, a boolean value, or
 *       another reference is replaced by that value, so {@code foo = $(x); bar = $(foo)} becomes
 *       {@code bar = $(x)}; references to larger values are kept to avoid duplicating them;
 *   <li>boolean operators with constant operands are folded, and conditionals with a constant
 *       condition are replaced by the selected branch.
 * </ul>
 *
 * The result is still normalized for the variable's type. Applying a Simplifier to its own result
 * changes nothing. It assumes that there are no cyclic references (see {@link
 * SelfReferenceChecker}).
 */
class Simplifier extends ExprRewriter {

  /** The simplified value of each variable visited through a reference. */
  private final Map<Variable, Memo> memos = new IdentityHashMap<>();

  /**
   * A simplified value, along with the value it was computed from; it is only valid while the
   * variable still holds {@code source}.
   */
  private record Memo(Expr source, Expr result) {}

  /**
   * Returns the simplified form of {@code var}'s current value, normalized again for the variable's
   * type: inlining can turn a list variable's {@code $(x)} into the plain value of {@code x}.
   */
  final Expr simplifiedValue(Variable var) {
    Expr value = var.value();
    Memo memo = memos.get(var);
    if (memo == null || memo.source() != value) {
      memo = new Memo(value, var.type.normalize(visit(value)));
      memos.put(var, memo);
    }
    return memo.result();
  }

  @Override
  protected Expr reference(ReferenceExpr e) {
    Variable var = e.resolve();
    if (var == null) {
      return e;
    }
    Expr value = simplifiedValue(var);
    return switch (value.kind()) {
      case LITERAL, BOOL_VALUE, REFERENCE -> value;
      default -> e;
    };
  }

  @Override
  protected Expr concat(ConcatExpr e) {
    ImmutableList<Expr> items = visitAll(e.items);
    boolean changed = items != e.items;
    List<Expr> result = new ArrayList<>(items.size());
    for (Expr item : items) {
      if (item instanceof ConcatExpr nested) {
        // Flatten; the nested items may merge with their new neighbours.
        nested.items.forEach(i -> addConcatItem(result, i));
        changed = true;
      } else {
        changed |= addConcatItem(result, item);
      }
    }
    if (result.isEmpty()) {
      return new LiteralExpr("", e.pos);
    } else if (result.size() == 1) {
      return result.get(0);
    }
    return changed ? new ConcatExpr(result, e.pos) : e;
  }

  /**
   * Adds {@code item} to the end of a concatenation, merging it with a preceding literal or
   * dropping it if it is empty. Returns true if it was merged or dropped.
   */
  private static boolean addConcatItem(List<Expr> items, Expr item) {
    if (item instanceof LiteralExpr literal) {
      if (literal.value.isEmpty()) {
        return true;
      }
      int last = items.size() - 1;
      if (last >= 0 && items.get(last) instanceof LiteralExpr prev) {
        items.set(last, new LiteralExpr(prev.value + literal.value, prev.pos));
        return true;
      }
    }
    items.add(item);
    return false;
  }

  @Override
  protected Expr bool(BoolExpr e) {
    ImmutableList<Expr> operands = visitAll(e.operands);
    Expr folded = fold(e, operands);
    if (folded != null) {
      return folded;
    }
    return (operands == e.operands) ? e : new BoolExpr(e.operator, operands, e.pos);
  }

  /**
   * Returns the value of {@code e} with the given (simplified) operands if it can be determined
   * statically, or null.
   */
  @Nullable Expr fold(BoolExpr e, List<Expr> operands) {
    Expr left = operands.get(0);
    switch (e.operator) {
      case NOT:
        if (left instanceof BoolValueExpr value) {
          return new BoolValueExpr(!value.value, e.pos);
        }
        return null;
      case AND:
        return foldAndOr(e, left, operands.get(1), false);
      case OR:
        return foldAndOr(e, left, operands.get(1), true);
      case EQUAL:
      case NOT_EQUAL:
        Expr right = operands.get(1);
        if (Exprs.isConstant(left) && Exprs.isConstant(right)) {
          boolean equal = Exprs.constantText(left).equals(Exprs.constantText(right));
          return new BoolValueExpr(equal == (e.operator == BoolExpr.Operator.EQUAL), e.pos);
        }
        return null;
    }
    throw new AssertionError(e.operator);
  }

  /**
   * Folds AND ({@code dominant} false) or OR ({@code dominant} true): if either operand is the
   * dominant value, so is the result; an operand with the other value can be dropped.
   */
  private static @Nullable Expr foldAndOr(BoolExpr e, Expr left, Expr right, boolean dominant) {
    if (isBoolValue(left, dominant) || isBoolValue(right, dominant)) {
      return new BoolValueExpr(dominant, e.pos);
    } else if (isBoolValue(left, !dominant)) {
      return right;
    } else if (isBoolValue(right, !dominant)) {
      return left;
    }
    return null;
  }

  private static boolean isBoolValue(Expr e, boolean value) {
    return e instanceof BoolValueExpr bool && bool.value == value;
  }

  @Override
  protected Expr ifExpr(IfExpr e) {
    Expr cond = visit(e.cond);
    if (cond instanceof BoolValueExpr value) {
      return visit(value.value ? e.yes : e.no);
    }
    Expr yes = visit(e.yes);
    Expr no = visit(e.no);
    if (cond == e.cond && yes == e.yes && no == e.no) {
      return e;
    }
    return new IfExpr(cond, yes, no, e.pos);
  }
}
