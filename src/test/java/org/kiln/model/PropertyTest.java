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

package org.kiln.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.kiln.model.TestModels.list;
import static org.kiln.model.TestModels.lit;
import static org.kiln.model.TestModels.path;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kiln.KilnError;
import org.kiln.expr.Anchor;
import org.kiln.expr.Expr;
import org.kiln.expr.ListExpr;
import org.kiln.expr.NullExpr;
import org.kiln.vartypes.ListType;
import org.kiln.vartypes.PathType;
import org.kiln.vartypes.StringType;

@RunWith(JUnit4.class)
public class PropertyTest {

  private final Project project = TestModels.newProject();
  private final Target target = project.topModule().addTarget("app", null);

  @Test
  public void noDefaultIsNull() {
    Property prop = new Property("flags", StringType.INSTANCE);
    assertThat(prop.defaultExpr(target)).isInstanceOf(NullExpr.class);
  }

  @Test
  public void computedDefaultSeesItsPart() {
    Property prop =
        Property.withComputedDefault(
            "id", StringType.INSTANCE, part -> lit(part.toString()), true, null);
    assertThat(prop.defaultExpr(target)).isEqualTo(lit("target \"app\""));
  }

  @Test
  public void failingDefaultIsFatalAndNamesTheContext() {
    IllegalStateException cause = new IllegalStateException("no compiler configured");
    Property prop =
        Property.withComputedDefault(
            "cc",
            StringType.INSTANCE,
            part -> {
              throw cause;
            },
            false,
            null);
    KilnError e = assertThrows(KilnError.class, () -> prop.defaultExpr(target));
    assertThat(e).hasMessageThat().contains("property \"cc\"");
    assertThat(e).hasMessageThat().contains("target \"app\"");
    assertThat(e).hasMessageThat().contains("no compiler configured");
    assertThat(e).hasCauseThat().isSameInstanceAs(cause);
  }

  @Test
  public void fixedDefaultPathsAreNotShared() {
    ListExpr sources = list(path(Anchor.SRCDIR, "main.c"));
    Property prop =
        new Property("sources", new ListType(PathType.INSTANCE), sources, false, "sources");
    Expr first = prop.defaultExpr(target);
    Expr second = prop.defaultExpr(project.topModule());
    assertThat(first).isEqualTo(sources);
    assertThat(((ListExpr) first).items.get(0))
        .isNotSameInstanceAs(((ListExpr) second).items.get(0));
  }
}
