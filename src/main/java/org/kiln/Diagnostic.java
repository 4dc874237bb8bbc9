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

/** A non-fatal problem found in a build description, such as a variable that is never used. */
public record Diagnostic(String message, @Nullable Position pos) {

  @Override
  public String toString() {
    return (pos == null) ? message : String.format("%s (%s)", message, pos);
  }
}
