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
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A list of values, e.g. the sources of a target. */
public final class ListExpr extends Expr {
  public final ImmutableList<Expr> items;

  public ListExpr(List<? extends Expr> items, @Nullable Position pos) {
    super(pos);
    this.items = ImmutableList.copyOf(items);
  }

  public ListExpr(List<? extends Expr> items) {
    this(items, null);
  }

  @Override
  public Kind kind() {
    return Kind.LIST;
  }

  @Override
  public ImmutableList<Expr> children() {
    return items;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ListExpr other && items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return 11 + items.hashCode();
  }

  @Override
  public String toString() {
    return items.toString();
  }
}
