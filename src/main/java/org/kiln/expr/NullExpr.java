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

/** The absence of a value, e.g. the default of a property that doesn't declare one. */
public final class NullExpr extends Expr {

  public NullExpr(@Nullable Position pos) {
    super(pos);
  }

  public NullExpr() {
    this(null);
  }

  @Override
  public Kind kind() {
    return Kind.NULL;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof NullExpr;
  }

  @Override
  public int hashCode() {
    return NullExpr.class.hashCode();
  }

  @Override
  public String toString() {
    return "null";
  }
}
