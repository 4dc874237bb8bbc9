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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;
import org.kiln.expr.Position;

/** All errors in a build description detected by the analysis passes throw a KilnError. */
public class KilnError extends RuntimeException {
  public final String msg;
  public final @Nullable Position pos;

  public KilnError(String msg, @Nullable Position pos) {
    super(msg);
    this.msg = msg;
    this.pos = pos;
  }

  public KilnError(String msg, @Nullable Position pos, Throwable cause) {
    super(msg, cause);
    this.msg = msg;
    this.pos = pos;
  }

  /** Returns a new KilnError with a formatted message. */
  @FormatMethod
  public static KilnError error(@Nullable Position pos, String fmt, Object... fmtArgs) {
    return new KilnError(String.format(fmt, fmtArgs), pos);
  }

  @Override
  public String getMessage() {
    return (pos == null) ? msg : String.format("%s (%s)", msg, pos);
  }
}
