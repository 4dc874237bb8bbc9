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
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.kiln.ContextError;
import org.kiln.Diagnostic;
import org.kiln.SelfReferenceError;
import org.kiln.TypeError;
import org.kiln.expr.Expr;
import org.kiln.ext.Toolset;
import org.kiln.model.Module;
import org.kiln.model.Project;
import org.kiln.model.Target;
import org.kiln.model.Variable;

/**
 * The analysis and optimization passes that run over a model between parsing and code generation.
 * Each pass takes the whole model and updates variable values in place; passes don't communicate
 * except through the model.
 *
 * <p>{@link Pipeline} runs them in the required order.
 */
public final class Passes {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Static methods only
  private Passes() {}

  /**
   * Verifies that no variable is defined recursively ({@code foo = $(foo)}, or a longer cycle).
   *
   * @throws SelfReferenceError naming the first variable found to be part of a cycle
   */
  public static void detectSelfReferences(Project project) {
    logger.atFine().log("checking for self-references");
    SelfReferenceChecker.apply(project);
  }

  /**
   * Returns a warning for each variable that is never referenced, which may indicate a typo.
   * Properties are never reported.
   */
  public static ImmutableList<Diagnostic> detectUnusedVars(Project project) {
    logger.atFine().log("checking for unused variables");
    return UnusedVariableChecker.apply(project);
  }

  /**
   * Normalizes variables' values with respect to their types (for example, changes non-list values
   * of list variables into single-item lists) and then validates them.
   *
   * @throws TypeError for the first value found that doesn't match its variable's type
   */
  public static void normalizeAndValidateVars(Project project) {
    TypeNormalizer.apply(project);
  }

  /**
   * Rewrites paths relative to {@code @srcdir} in terms of {@code @top_srcdir}, and (if {@code
   * toolset} is non-null) paths relative to {@code @builddir} in a toolset-specific way.
   *
   * @throws ContextError if a {@code @builddir} path appears outside of a target, or a {@code
   *     @srcdir} path in a project-level variable
   */
  public static void normalizePaths(Project project, @Nullable Toolset toolset) {
    logger.atFine().log("translating relative paths into absolute");
    PathsNormalizer.apply(project, toolset);
  }

  /**
   * Performs cheap simplifications such as merging concatenated literals, folding constant
   * conditions, and eliminating unnecessary references (see {@link Simplifier}).
   */
  public static void simplifyExprs(Project project) {
    logger.atFine().log("simplifying expressions");
    Simplifier simplifier = new Simplifier();
    for (Variable var : project.allVariables()) {
      var.setValue(simplifier.simplifiedValue(var));
    }
  }

  /**
   * Removes as much conditional content as possible, repeating until a pass over all variables
   * changes nothing. This is more expensive than {@link #simplifyExprs}.
   *
   * @return the number of passes made, including the final one that changed nothing
   */
  @CanIgnoreReturnValue
  public static int eliminateSuperfluousConditionals(Project project) {
    ImmutableList<Variable> all = project.allVariables();
    ConditionalsSimplifier simplifier = new ConditionalsSimplifier();
    for (int iteration = 1; ; iteration++) {
      logger.atFine().log("removing superfluous conditional expressions: pass %d", iteration);
      boolean modified = false;
      for (Variable var : all) {
        Expr old = var.value();
        var.setValue(simplifier.simplifiedValue(var));
        if (old != var.value()) {
          modified = true;
        }
      }
      if (!modified) {
        return iteration;
      }
    }
  }

  /**
   * Creates variables holding the default values of all properties that don't have a value yet,
   * throughout the model. This is part of building the model and must be done (if at all) before
   * running the {@link Pipeline}, which never adds variables.
   */
  public static void makeVariablesForMissingProps(Project project, @Nullable Toolset toolset) {
    logger.atFine().log("adding properties' default values");
    project.makeVariablesForMissingProps(toolset);
    for (Module module : project.modules()) {
      module.makeVariablesForMissingProps(toolset);
      for (Target target : module.targets()) {
        target.makeVariablesForMissingProps(toolset);
      }
    }
  }
}
