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
import static org.kiln.model.TestModels.list;
import static org.kiln.model.TestModels.lit;
import static org.kiln.model.TestModels.path;
import static org.kiln.model.TestModels.ref;
import static org.kiln.model.TestModels.var;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kiln.ContextError;
import org.kiln.expr.Anchor;
import org.kiln.expr.PathExpr;
import org.kiln.model.Module;
import org.kiln.model.Project;
import org.kiln.model.Target;
import org.kiln.model.TestModels;
import org.kiln.model.Variable;

@RunWith(JUnit4.class)
public class PathsNormalizerTest {

  private final Project project = TestModels.newProject();
  private final Module top = project.topModule();
  private final Module sub = project.addModule("project/sub/dir/module");

  @Test
  public void srcdirPathsAreRewrittenRelativeToTopModule() {
    PathExpr p = path(Anchor.SRCDIR, "foo.c");
    var(sub, "src", p);
    Passes.normalizePaths(project, null);
    assertThat(p.anchor()).isEqualTo(Anchor.TOP_SRCDIR);
    assertThat(p.components()).containsExactly(lit("sub"), lit("dir"), lit("foo.c")).inOrder();
  }

  @Test
  public void topModuleGetsNoPrefix() {
    PathExpr p = path(Anchor.SRCDIR, "src", "main.c");
    var(top, "src", p);
    Passes.normalizePaths(project, null);
    assertThat(p).isEqualTo(path(Anchor.TOP_SRCDIR, "src", "main.c"));
  }

  @Test
  public void moduleInSameDirectoryGetsNoPrefix() {
    Module sibling = project.addModule("project/other");
    PathExpr p = path(Anchor.SRCDIR, "x.c");
    var(sibling, "src", p);
    Passes.normalizePaths(project, null);
    assertThat(p).isEqualTo(path(Anchor.TOP_SRCDIR, "x.c"));
  }

  @Test
  public void nestedPathsAreRewritten() {
    PathExpr a = path(Anchor.SRCDIR, "a.c");
    PathExpr b = path(Anchor.SRCDIR, "b.c");
    Target app = sub.addTarget("app", null);
    var(app, "sources", list(a, concat(lit("-I"), b)));
    Passes.normalizePaths(project, null);
    assertThat(a).isEqualTo(path(Anchor.TOP_SRCDIR, "sub", "dir", "a.c"));
    assertThat(b).isEqualTo(path(Anchor.TOP_SRCDIR, "sub", "dir", "b.c"));
  }

  @Test
  public void otherAnchorsAreLeftAlone() {
    PathExpr p = path(Anchor.named("@external"), "lib");
    var(sub, "lib", p);
    Passes.normalizePaths(project, new FakeToolset());
    assertThat(p).isEqualTo(path(Anchor.named("@external"), "lib"));
  }

  @Test
  public void builddirOutsideTargetIsAnError() {
    var(top, "out", path(Anchor.BUILDDIR, "out.o"));
    ContextError e =
        assertThrows(ContextError.class, () -> Passes.normalizePaths(project, new FakeToolset()));
    assertThat(e.msg).isEqualTo("@builddir references are not allowed outside of targets");
  }

  @Test
  public void builddirOutsideTargetIsAnErrorWithoutToolset() {
    var(sub, "out", path(Anchor.BUILDDIR, "out.o"));
    assertThrows(ContextError.class, () -> Passes.normalizePaths(project, null));
  }

  @Test
  public void builddirIsResolvedByToolset() {
    FakeToolset toolset = new FakeToolset();
    Target app = top.addTarget("app", null);
    Target lib = top.addTarget("lib", null);
    PathExpr obj = path(Anchor.BUILDDIR, "main.o");
    PathExpr exe = path(Anchor.BUILDDIR, "app");
    PathExpr libObj = path(Anchor.BUILDDIR, "lib.o");
    var(app, "objects", list(obj));
    var(app, "output", exe);
    var(lib, "objects", list(libObj));

    Passes.normalizePaths(project, toolset);

    assertThat(obj).isEqualTo(path(Anchor.TOP_SRCDIR, "build", "app", "main.o"));
    assertThat(exe).isEqualTo(path(Anchor.TOP_SRCDIR, "build", "app", "app"));
    assertThat(libObj).isEqualTo(path(Anchor.TOP_SRCDIR, "build", "lib", "lib.o"));
    // The toolset is asked once per target, however many paths there are.
    assertThat(toolset.requests).containsExactly(app, lib).inOrder();
    // The paths were extended with copies; the toolset's own directories are untouched.
    assertThat(toolset.builddirs)
        .containsExactly(
            path(Anchor.TOP_SRCDIR, "build", "app"), path(Anchor.TOP_SRCDIR, "build", "lib"))
        .inOrder();
  }

  @Test
  public void srcdirRelativeBuilddirIsThenRewritten() {
    FakeToolset toolset = new FakeToolset(Anchor.SRCDIR);
    Target app = sub.addTarget("app", null);
    PathExpr obj = path(Anchor.BUILDDIR, "out.o");
    PathExpr exe = path(Anchor.BUILDDIR, "out");
    var(app, "objects", list(obj));
    var(app, "output", exe);
    Passes.normalizePaths(project, toolset);
    assertThat(obj).isEqualTo(path(Anchor.TOP_SRCDIR, "sub", "dir", "build", "app", "out.o"));
    assertThat(exe).isEqualTo(path(Anchor.TOP_SRCDIR, "sub", "dir", "build", "app", "out"));
    // Rewriting the first path must not have rewritten the cached build directory.
    assertThat(toolset.builddirs).containsExactly(path(Anchor.SRCDIR, "build", "app"));
  }

  @Test
  public void builddirIsLeftAloneWithoutToolset() {
    Target app = top.addTarget("app", null);
    PathExpr p = path(Anchor.BUILDDIR, "out.o");
    var(app, "out", p);
    Passes.normalizePaths(project, null);
    assertThat(p).isEqualTo(path(Anchor.BUILDDIR, "out.o"));
  }

  @Test
  public void toolsetMustNotReturnBuilddir() {
    Target app = top.addTarget("app", null);
    var(app, "out", path(Anchor.BUILDDIR, "out.o"));
    assertThrows(
        IllegalStateException.class,
        () -> Passes.normalizePaths(project, new FakeToolset(Anchor.BUILDDIR)));
  }

  @Test
  public void pathComponentsMayBeExpressions() {
    Target app = sub.addTarget("app", null);
    var(sub, "name", lit("main"));
    PathExpr p =
        new PathExpr(Anchor.SRCDIR, ImmutableList.of(concat(ref("name", app), lit(".c"))));
    var(app, "src", p);
    Passes.normalizePaths(project, null);
    assertThat(p.anchor()).isEqualTo(Anchor.TOP_SRCDIR);
    assertThat(p.components())
        .containsExactly(lit("sub"), lit("dir"), concat(ref("name", app), lit(".c")))
        .inOrder();
  }

  @Test
  public void normalizingTwiceChangesNothing() {
    Target app = sub.addTarget("app", null);
    var(sub, "src", path(Anchor.SRCDIR, "a.c"));
    var(app, "out", path(Anchor.BUILDDIR, "a.o"));
    Passes.normalizePaths(project, new FakeToolset());
    ImmutableList<String> before = TestModels.dump(project);
    Passes.normalizePaths(project, new FakeToolset());
    assertThat(TestModels.dump(project)).isEqualTo(before);
  }

  @Test
  public void srcdirPathsNeedAModule() {
    PathsNormalizer normalizer = new PathsNormalizer(null);
    ContextError e =
        assertThrows(ContextError.class, () -> normalizer.visit(path(Anchor.SRCDIR, "a.c")));
    assertThat(e.msg).isEqualTo("@srcdir paths can only be resolved within a module");
  }

  @Test
  public void projectVariablesAreChecked() {
    var(project, "readme", path(Anchor.SRCDIR, "README"));
    ContextError e = assertThrows(ContextError.class, () -> Passes.normalizePaths(project, null));
    assertThat(e.msg).isEqualTo("@srcdir paths can only be resolved within a module");
  }

  @Test
  public void projectVariablesMayHoldAnchoredPaths() {
    PathExpr p = path(Anchor.TOP_SRCDIR, "include");
    var(project, "includedir", p);
    Passes.normalizePaths(project, new FakeToolset());
    assertThat(p).isEqualTo(path(Anchor.TOP_SRCDIR, "include"));
  }

  @Test
  public void builddirIsNotAllowedInProjectVariables() {
    var(project, "out", path(Anchor.BUILDDIR, "out"));
    assertThrows(ContextError.class, () -> Passes.normalizePaths(project, new FakeToolset()));
  }

  @Test
  public void variablesAreRewrittenInPlace() {
    PathExpr p = path(Anchor.SRCDIR, "a.c");
    Variable src = var(sub, "src", p);
    Passes.normalizePaths(project, null);
    assertThat(src.value()).isSameInstanceAs(p);
  }
}
