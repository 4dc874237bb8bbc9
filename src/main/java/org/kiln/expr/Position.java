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

package org.kiln.expr;

import org.jspecify.annotations.Nullable;

/**
 * A location in a build description file, attached to expressions so that errors and warnings can
 * point at the offending source.
 *
 * @param file the source file name, or null if the expression was not read from a file
 */
public record Position(@Nullable String file, int line, int column) {

  @Override
  public String toString() {
    String prefix = (file == null) ? "" : file + ":";
    return prefix + line + ":" + column;
  }
}
