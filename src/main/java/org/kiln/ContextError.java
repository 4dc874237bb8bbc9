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
 * Thrown when an expression can only be interpreted relative to a module or target, but none (or
 * not the right kind) was available, e.g. a {@code @builddir} path outside of any target.
 */
public class ContextError extends KilnError {
  public ContextError(String msg, @Nullable Position pos) {
    super(msg, pos);
  }
}
