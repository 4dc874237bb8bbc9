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
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A file system path, relative to an {@link Anchor}. Each component is an expression of its own
 * (usually a literal, but it may be e.g. a reference that expands to a file name).
 *
 * <p>Unlike other Exprs, a PathExpr is mutable: path normalization re-anchors it in place. A
 * PathExpr must therefore never be shared between two trees.
 */
public final class PathExpr extends Expr {
  private Anchor anchor;
  private ImmutableList<Expr> components;

  public PathExpr(Anchor anchor, List<? extends Expr> components, @Nullable Position pos) {
    super(pos);
    this.anchor = checkNotNull(anchor);
    this.components = ImmutableList.copyOf(components);
  }

  public PathExpr(Anchor anchor, List<? extends Expr> components) {
    this(anchor, components, null);
  }

  public Anchor anchor() {
    return anchor;
  }

  public ImmutableList<Expr> components() {
    return components;
  }

  public void setAnchor(Anchor anchor) {
    this.anchor = checkNotNull(anchor);
  }

  public void setComponents(List<? extends Expr> components) {
    this.components = ImmutableList.copyOf(components);
  }

  /** Inserts {@code prefix} ahead of the current components. */
  public void prependComponents(List<? extends Expr> prefix) {
    this.components =
        ImmutableList.<Expr>builderWithExpectedSize(prefix.size() + components.size())
            .addAll(prefix)
            .addAll(components)
            .build();
  }

  @Override
  public Kind kind() {
    return Kind.PATH;
  }

  @Override
  public ImmutableList<Expr> children() {
    return components;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof PathExpr other
        && anchor.equals(other.anchor)
        && components.equals(other.components);
  }

  @Override
  public int hashCode() {
    return 31 * anchor.hashCode() + components.hashCode();
  }

  @Override
  public String toString() {
    if (components.isEmpty()) {
      return anchor.toString();
    }
    return anchor
        + "/"
        + components.stream().map(PathExpr::componentText).collect(Collectors.joining("/"));
  }

  /** Literal components are shown unquoted, as they would be written in a path. */
  private static String componentText(Expr component) {
    return (component instanceof LiteralExpr literal) ? literal.value : component.toString();
  }
}
