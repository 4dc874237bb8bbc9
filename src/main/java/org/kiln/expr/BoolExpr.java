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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A boolean operator applied to one or two operands. */
public final class BoolExpr extends Expr {

  /** The supported operators. NOT takes one operand, all others take two. */
  public enum Operator {
    AND("&&"),
    OR("||"),
    NOT("!"),
    EQUAL("=="),
    NOT_EQUAL("!=");

    public final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public int arity() {
      return (this == NOT) ? 1 : 2;
    }

    /**
     * Returns true if the operands of this operator must themselves be boolean; EQUAL and NOT_EQUAL
     * compare arbitrary values.
     */
    public boolean hasBoolOperands() {
      return this == AND || this == OR || this == NOT;
    }
  }

  public final Operator operator;
  public final ImmutableList<Expr> operands;

  public BoolExpr(Operator operator, List<? extends Expr> operands, @Nullable Position pos) {
    super(pos);
    checkArgument(
        operands.size() == operator.arity(),
        "%s takes %s operand(s), got %s",
        operator,
        operator.arity(),
        operands.size());
    this.operator = operator;
    this.operands = ImmutableList.copyOf(operands);
  }

  public BoolExpr(Operator operator, List<? extends Expr> operands) {
    this(operator, operands, null);
  }

  /** Returns the first (or only) operand. */
  public Expr left() {
    return operands.get(0);
  }

  /** Returns the second operand; not valid for NOT. */
  public Expr right() {
    return operands.get(1);
  }

  @Override
  public Kind kind() {
    return Kind.BOOL;
  }

  @Override
  public ImmutableList<Expr> children() {
    return operands;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof BoolExpr other
        && operator == other.operator
        && operands.equals(other.operands);
  }

  @Override
  public int hashCode() {
    return 31 * operator.hashCode() + operands.hashCode();
  }

  @Override
  public String toString() {
    if (operator == Operator.NOT) {
      return "!" + left();
    }
    return "(" + left() + " " + operator.symbol + " " + right() + ")";
  }
}
