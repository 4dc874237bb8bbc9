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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.kiln.model.TestModels.and;
import static org.kiln.model.TestModels.bool;
import static org.kiln.model.TestModels.eq;
import static org.kiln.model.TestModels.ifExpr;
import static org.kiln.model.TestModels.list;
import static org.kiln.model.TestModels.lit;
import static org.kiln.model.TestModels.not;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kiln.TypeError;
import org.kiln.expr.Expr;

@RunWith(JUnit4.class)
public class BoolSubexpressionsTest {

  @Test
  public void conditionsBecomeBooleans() {
    Expr e = ifExpr(lit("true"), lit("a"), lit("b"));
    assertThat(BoolSubexpressions.normalizeAndValidate(e))
        .isEqualTo(ifExpr(bool(true), lit("a"), lit("b")));
  }

  @Test
  public void logicalOperandsBecomeBooleans() {
    Expr e = list(not(and(lit("false"), lit("true"))));
    assertThat(BoolSubexpressions.normalizeAndValidate(e))
        .isEqualTo(list(not(and(bool(false), bool(true)))));
  }

  @Test
  public void comparisonOperandsAreLeftAlone() {
    Expr e = ifExpr(eq(lit("true"), lit("gnu")), lit("a"), lit("b"));
    assertThat(BoolSubexpressions.normalizeAndValidate(e)).isSameInstanceAs(e);
  }

  @Test
  public void branchesAreNotConditions() {
    Expr e = ifExpr(bool(false), lit("true"), lit("b"));
    assertThat(BoolSubexpressions.normalizeAndValidate(e)).isSameInstanceAs(e);
  }

  @Test
  public void invalidConditionIsATypeError() {
    Expr bad = lit("maybe", 2);
    TypeError e =
        assertThrows(
            TypeError.class,
            () -> BoolSubexpressions.normalizeAndValidate(ifExpr(bad, lit("a"), lit("b"))));
    assertThat(e.expr).isSameInstanceAs(bad);
    assertThat(e.type).isSameInstanceAs(BoolType.INSTANCE);
  }
}
