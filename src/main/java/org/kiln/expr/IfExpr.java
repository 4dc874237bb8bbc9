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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A conditional value: {@code yes} if {@code cond} holds, {@code no} otherwise. */
public final class IfExpr extends Expr {
  public final Expr cond;
  public final Expr yes;
  public final Expr no;

  public IfExpr(Expr cond, Expr yes, Expr no, @Nullable Position pos) {
    super(pos);
    this.cond = checkNotNull(cond);
    this.yes = checkNotNull(yes);
    this.no = checkNotNull(no);
  }

  public IfExpr(Expr cond, Expr yes, Expr no) {
    this(cond, yes, no, null);
  }

  @Override
  public Kind kind() {
    return Kind.IF;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of(cond, yes, no);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof IfExpr other
        && cond.equals(other.cond)
        && yes.equals(other.yes)
        && no.equals(other.no);
  }

  @Override
  public int hashCode() {
    return ((31 * cond.hashCode()) + yes.hashCode()) * 31 + no.hashCode();
  }

  @Override
  public String toString() {
    return "$(" + cond + " ? " + yes + " : " + no + ")";
  }
}
