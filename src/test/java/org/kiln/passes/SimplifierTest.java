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

import static com.google.common.truth.Truth.assertThat;
import static org.kiln.model.TestModels.and;
import static org.kiln.model.TestModels.bool;
import static org.kiln.model.TestModels.concat;
import static org.kiln.model.TestModels.eq;
import static org.kiln.model.TestModels.ifExpr;
import static org.kiln.model.TestModels.list;
import static org.kiln.model.TestModels.lit;
import static org.kiln.model.TestModels.ne;
import static org.kiln.model.TestModels.not;
import static org.kiln.model.TestModels.or;
import static org.kiln.model.TestModels.pos;
import static org.kiln.model.TestModels.ref;
import static org.kiln.model.TestModels.var;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.kiln.expr.Expr;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Module;
import org.kiln.model.Project;
import org.kiln.model.TestModels;
import org.kiln.model.Variable;

@RunWith(TestParameterInjector.class)
public class SimplifierTest {

  private final Project project = TestModels.newProject();
  private final Module module = project.topModule();

  /** A reference that stays put: "config" is never defined. */
  private ReferenceExpr config() {
    return ref("config", module);
  }

  private Expr simplify(Expr e) {
    Variable v = var(module, "v" + module.variables().size(), e);
    Passes.simplifyExprs(project);
    return v.value();
  }

  @Test
  public void adjacentLiteralsAreMerged() {
    assertThat(simplify(concat(lit("a"), lit("b"), config(), lit(""), lit("c"), lit("d"))))
        .isEqualTo(concat(lit("ab"), config(), lit("cd")));
  }

  @Test
  public void mergedLiteralKeepsFirstPosition() {
    Expr result = simplify(concat(lit("a", 4), lit("b", 5), config()));
    assertThat(result.children().get(0).pos).isEqualTo(pos(4));
  }

  @Test
  public void nestedConcatenationsAreFlattened() {
    assertThat(simplify(concat(lit("a"), concat(lit("b"), config()), lit("c"))))
        .isEqualTo(concat(lit("ab"), config(), lit("c")));
  }

  @Test
  public void concatenationOfLiteralsBecomesLiteral() {
    assertThat(simplify(concat(lit("lib"), lit("foo"), lit(".a")))).isEqualTo(lit("libfoo.a"));
  }

  @Test
  public void emptyConcatenationBecomesEmptyLiteral() {
    assertThat(simplify(concat(lit(""), lit("")))).isEqualTo(lit(""));
  }

  @Test
  public void singleItemConcatenationBecomesItsItem() {
    assertThat(simplify(concat(lit(""), config()))).isEqualTo(config());
  }

  @Test
  public void referencesToReferencesAreShortened() {
    var(module, "x", list(lit("a"), lit("b")));
    var(module, "foo", ref("x", module));
    Variable bar = var(module, "bar", ref("foo", module));
    Passes.simplifyExprs(project);
    assertThat(bar.value()).isEqualTo(ref("x", module));
  }

  @Test
  public void referencesToLargerValuesAreKept() {
    var(module, "x", list(lit("a"), lit("b")));
    Variable y = var(module, "y", concat(ref("x", module), lit("!")));
    Passes.simplifyExprs(project);
    assertThat(y.value()).isEqualTo(concat(ref("x", module), lit("!")));
  }

  @Test
  public void forwardReferencesAreSimplifiedInOnePass() {
    Variable a = var(module, "a", concat(ref("b", module), lit("!")));
    Variable b = var(module, "b", concat(lit("x"), lit("y")));
    Passes.simplifyExprs(project);
    assertThat(a.value()).isEqualTo(lit("xy!"));
    assertThat(b.value()).isEqualTo(lit("xy"));
  }

  @Test
  public void notOfConstantIsFolded(@TestParameter boolean value) {
    assertThat(simplify(not(bool(value)))).isEqualTo(bool(!value));
  }

  @Test
  public void andWithConstantIsFolded(@TestParameter boolean value) {
    Expr expected = value ? config() : bool(false);
    assertThat(simplify(and(bool(value), config()))).isEqualTo(expected);
    assertThat(simplify(and(config(), bool(value)))).isEqualTo(expected);
  }

  @Test
  public void orWithConstantIsFolded(@TestParameter boolean value) {
    Expr expected = value ? bool(true) : config();
    assertThat(simplify(or(bool(value), config()))).isEqualTo(expected);
    assertThat(simplify(or(config(), bool(value)))).isEqualTo(expected);
  }

  @Test
  public void comparisonsOfConstantsAreFolded() {
    assertThat(simplify(eq(lit("gnu"), lit("gnu")))).isEqualTo(bool(true));
    assertThat(simplify(eq(lit("gnu"), lit("msvc")))).isEqualTo(bool(false));
    assertThat(simplify(ne(lit("gnu"), lit("msvc")))).isEqualTo(bool(true));
  }

  @Test
  public void comparisonsThroughVariablesAreFolded() {
    var(module, "toolset", lit("gnu"));
    assertThat(simplify(eq(ref("toolset", module), lit("gnu")))).isEqualTo(bool(true));
  }

  @Test
  public void comparisonWithUnknownValueIsKept() {
    assertThat(simplify(eq(config(), lit("debug")))).isEqualTo(eq(config(), lit("debug")));
  }

  @Test
  public void conditionalWithConstantConditionIsReplacedByBranch(@TestParameter boolean value) {
    Expr e = ifExpr(not(bool(!value)), concat(lit("a"), lit("1")), lit("b"));
    assertThat(simplify(e)).isEqualTo(value ? lit("a1") : lit("b"));
  }

  @Test
  public void conditionalWithEqualBranchesIsKept() {
    // Only the more thorough pass removes these.
    Expr e = ifExpr(config(), lit("a"), lit("a"));
    assertThat(simplify(e)).isEqualTo(ifExpr(config(), lit("a"), lit("a")));
  }

  @Test
  public void unchangedValuesKeepTheirIdentity() {
    Expr e = ifExpr(eq(config(), lit("debug")), list(lit("-g")), list(concat(config(), lit("x"))));
    assertThat(simplify(e)).isSameInstanceAs(e);
  }

  @Test
  public void simplifyingTwiceChangesNothing() {
    var(project, "version", lit("1.0"));
    var(module, "name", concat(lit("kiln-"), ref("version", module)));
    var(module, "archive", concat(ref("name", module), lit(".tar"), concat(lit(".gz"))));
    var(module, "flags", ifExpr(and(bool(true), config()), list(lit("-g")), list()));
    var(module, "alias", ref("flags", module));
    Passes.simplifyExprs(project);
    ImmutableList<Expr> before =
        project.allVariables().stream()
            .map(Variable::value)
            .collect(ImmutableList.toImmutableList());
    Passes.simplifyExprs(project);
    ImmutableList<Variable> after = project.allVariables();
    for (int i = 0; i < before.size(); i++) {
      assertThat(after.get(i).value()).isSameInstanceAs(before.get(i));
    }
    assertThat(TestModels.dump(project))
        .containsExactly(
            "version = \"1.0\"",
            "name = \"kiln-1.0\"",
            "archive = \"kiln-1.0.tar.gz\"",
            "flags = $($(config) ? [\"-g\"] : [])",
            "alias = $(flags)")
        .inOrder();
  }
}
