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
import static org.junit.Assert.assertThrows;
import static org.kiln.model.TestModels.concat;
import static org.kiln.model.TestModels.ifExpr;
import static org.kiln.model.TestModels.list;
import static org.kiln.model.TestModels.lit;
import static org.kiln.model.TestModels.pos;
import static org.kiln.model.TestModels.ref;
import static org.kiln.model.TestModels.var;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.kiln.SelfReferenceError;
import org.kiln.model.Module;
import org.kiln.model.Project;
import org.kiln.model.Target;
import org.kiln.model.TestModels;
import org.kiln.vartypes.StringType;

@RunWith(TestParameterInjector.class)
public class SelfReferenceCheckerTest {

  private final Project project = TestModels.newProject();
  private final Module module = project.topModule();

  @Test
  public void directSelfReference() {
    var(module, "a", concat(lit("x"), ref("a", module, 3)));
    SelfReferenceError e =
        assertThrows(SelfReferenceError.class, () -> Passes.detectSelfReferences(project));
    assertThat(e.varName).isEqualTo("a");
    assertThat(e.pos).isEqualTo(pos(3));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("variable \"a\" is defined recursively, references itself (test.bkl:3:1)");
  }

  @Test
  public void mutualReference() {
    var(module, "a", ref("b", module));
    var(module, "b", ref("a", module, 5));
    SelfReferenceError e =
        assertThrows(SelfReferenceError.class, () -> Passes.detectSelfReferences(project));
    assertThat(e.varName).isEqualTo("a");
    assertThat(e.pos).isEqualTo(pos(5));
  }

  @Test
  public void cycleReachableFromAnotherRoot(
      @TestParameter({"1", "2", "3", "10"}) int cycleLength) {
    // root -> v0 -> v1 -> ... -> v(n-1) -> v0
    var(module, "root", list(lit("first"), ref("v0", module)));
    for (int i = 0; i < cycleLength; i++) {
      int next = (i + 1) % cycleLength;
      var(module, "v" + i, concat(lit("-"), ref("v" + next, module, 100 + i)));
    }
    SelfReferenceError e =
        assertThrows(SelfReferenceError.class, () -> Passes.detectSelfReferences(project));
    assertThat(e.varName).isEqualTo("v0");
    assertThat(e.pos).isEqualTo(pos(100 + cycleLength - 1));
  }

  @Test
  public void acyclicGraphsPass() {
    // A diamond: d is reached twice but is not part of a cycle.
    var(module, "a", concat(ref("b", module), ref("c", module)));
    var(module, "b", ifExpr(TestModels.bool(true), ref("d", module), lit("")));
    var(module, "c", list(ref("d", module), ref("d", module)));
    var(module, "d", lit("leaf"));
    Passes.detectSelfReferences(project);
  }

  @Test
  public void propertyWithoutValueEndsTheSearch() {
    Target app = module.addTarget("app", null);
    var(app, "cflags", concat(ref("defines", app), lit(" -O2")));
    Passes.detectSelfReferences(project);
  }

  @Test
  public void targetVariableShadowingItselfIsRecursive() {
    // Within the target, $(name) refers to the target's own variable, not the module's.
    var(module, "name", lit("base"));
    Target app = module.addTarget("app", null);
    TestModels.prop(app, "name", concat(ref("name", app, 7), lit("_d")), StringType.INSTANCE);
    SelfReferenceError e =
        assertThrows(SelfReferenceError.class, () -> Passes.detectSelfReferences(project));
    assertThat(e.varName).isEqualTo("name");
    assertThat(e.pos).isEqualTo(pos(7));
  }

  @Test
  public void targetReferencingModuleVariableOfTheSameNameIsFine() {
    var(module, "name", lit("base"));
    Target app = module.addTarget("app", null);
    var(app, "name", concat(ref("name", module), lit("_d")));
    Passes.detectSelfReferences(project);
  }
}
