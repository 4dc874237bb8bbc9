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

package org.kiln;

import org.jspecify.annotations.Nullable;
import org.kiln.expr.Position;

/**
 * Thrown when a variable's value refers back to the variable itself, either directly ({@code foo =
 * $(foo)}) or through other variables.
 */
public class SelfReferenceError extends KilnError {
  /** The name of the variable that is defined recursively. */
  public final String varName;

  public SelfReferenceError(String varName, @Nullable Position pos) {
    super(
        String.format("variable \"%s\" is defined recursively, references itself", varName), pos);
    this.varName = varName;
  }
}
