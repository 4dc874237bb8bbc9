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

import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import org.kiln.SelfReferenceError;
import org.kiln.expr.ExprScanner;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Project;
import org.kiln.model.Variable;

/**
 * Verifies that no variable is defined in terms of itself, directly ({@code foo = $(foo)}) or
 * through other variables ({@code a = $(b); b = $(a)}).
 *
 * <p>This is a depth-first search of the graph whose edges are the references in each variable's
 * value. {@link #stack} holds the variables whose values are currently being visited; reaching one
 * of them again means there is a cycle. Variables whose values have been completely visited are
 * added to {@link #checked} and never visited again, so each variable's value is walked at most
 * once.
 */
final class SelfReferenceChecker extends ExprScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Checks every variable in the project; throws a SelfReferenceError if there is a cycle. */
  static void apply(Project project) {
    SelfReferenceChecker checker = new SelfReferenceChecker();
    for (Variable var : project.allVariables()) {
      checker.check(var);
    }
    logger.atFine().log("%d variables checked for self-references", checker.checked.size());
  }

  /** The variables being expanded, innermost last. */
  private final Deque<Variable> stack = new ArrayDeque<>();

  /** The same variables as {@link #stack}, for constant-time membership tests. */
  private final Set<Variable> onStack = Sets.newIdentityHashSet();

  private final Set<Variable> checked = Sets.newIdentityHashSet();

  private SelfReferenceChecker() {}

  private void check(Variable var) {
    if (checked.contains(var)) {
      return;
    }
    stack.addLast(var);
    onStack.add(var);
    try {
      visit(var.value());
    } finally {
      onStack.remove(stack.removeLast());
    }
    checked.add(var);
  }

  @Override
  protected void reference(ReferenceExpr e) {
    Variable var = e.resolve();
    if (var == null) {
      // A reference to the default value of a property.
      return;
    }
    if (onStack.contains(var)) {
      // TODO: include the chain of references (the contents of stack) in the error.
      throw new SelfReferenceError(var.name, e.pos);
    }
    check(var);
  }
}
