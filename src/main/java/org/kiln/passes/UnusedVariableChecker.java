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
import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import java.util.Set;
import org.kiln.Diagnostic;
import org.kiln.expr.ExprScanner;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Project;
import org.kiln.model.Variable;

/**
 * Finds variables that are defined but never referenced; they are often typos. Properties are
 * exempt, since they are used by the toolset rather than referenced from expressions.
 */
final class UnusedVariableChecker extends ExprScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Returns a warning for each unused variable in the project, in definition order. */
  static ImmutableList<Diagnostic> apply(Project project) {
    ImmutableList<Variable> all = project.allVariables();
    UnusedVariableChecker checker = new UnusedVariableChecker();
    all.forEach(var -> checker.visit(var.value()));
    ImmutableList.Builder<Diagnostic> warnings = ImmutableList.builder();
    for (Variable var : all) {
      if (!var.isProperty && !checker.used.contains(var)) {
        Diagnostic warning =
            new Diagnostic(String.format("variable \"%s\" is never used", var.name), var.pos);
        logger.atWarning().log("%s", warning);
        warnings.add(warning);
      }
    }
    return warnings.build();
  }

  private final Set<Variable> used = Sets.newIdentityHashSet();

  private UnusedVariableChecker() {}

  @Override
  protected void reference(ReferenceExpr e) {
    Variable var = e.resolve();
    if (var != null && !var.isProperty) {
      used.add(var);
    }
  }
}
