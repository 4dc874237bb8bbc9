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

import com.google.common.flogger.GoogleLogger;
import org.kiln.TypeError;
import org.kiln.model.Project;
import org.kiln.model.Variable;
import org.kiln.vartypes.BoolSubexpressions;

/**
 * Normalizes every variable's value with respect to its declared type (e.g. turns a single value
 * assigned to a list variable into a one-item list), then validates it.
 *
 * <p>The three steps each run over all variables before the next one starts: validating a
 * reference looks at the referenced variable's value, which must already be normalized.
 */
final class TypeNormalizer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Static methods only
  private TypeNormalizer() {}

  /** Normalizes and validates all variables; throws a TypeError on the first invalid value. */
  static void apply(Project project) {
    logger.atFine().log("checking boolean expressions");
    for (Variable var : project.allVariables()) {
      try {
        var.setValue(BoolSubexpressions.normalizeAndValidate(var.value()));
      } catch (TypeError e) {
        throw e.forVariable(var.name);
      }
    }

    logger.atFine().log("normalizing variables");
    for (Variable var : project.allVariables()) {
      var.setValue(var.type.normalize(var.value()));
    }

    logger.atFine().log("checking types of variables");
    for (Variable var : project.allVariables()) {
      try {
        var.type.validate(var.value());
      } catch (TypeError e) {
        throw e.forVariable(var.name);
      }
    }
  }
}
