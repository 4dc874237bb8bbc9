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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A boolean constant. */
public final class BoolValueExpr extends Expr {
  public final boolean value;

  public BoolValueExpr(boolean value, @Nullable Position pos) {
    super(pos);
    this.value = value;
  }

  public BoolValueExpr(boolean value) {
    this(value, null);
  }

  @Override
  public Kind kind() {
    return Kind.BOOL_VALUE;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof BoolValueExpr other && value == other.value;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public String toString() {
    return value ? "true" : "false";
  }
}
