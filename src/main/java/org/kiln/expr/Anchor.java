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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The root that a {@link PathExpr} is relative to.
 *
 * <p>The three standard anchors are constants of this class. Toolsets may introduce their own
 * anchors (e.g. the directory a generated project file lives in) with {@link #named}; those are
 * opaque to the passes, which only ever compare anchors for equality.
 */
public final class Anchor {

  /** The directory containing the source file of the module the path was written in. */
  public static final Anchor SRCDIR = new Anchor("@srcdir");

  /** The directory containing the source file of the project's top-level module. */
  public static final Anchor TOP_SRCDIR = new Anchor("@top_srcdir");

  /** The build directory of the target the path belongs to; its meaning is toolset-specific. */
  public static final Anchor BUILDDIR = new Anchor("@builddir");

  private final String name;

  private Anchor(String name) {
    this.name = name;
  }

  /** Returns an anchor with the given name, which must start with "@". */
  public static Anchor named(String name) {
    checkArgument(name.startsWith("@"), "anchor names start with '@': %s", name);
    switch (name) {
      case "@srcdir":
        return SRCDIR;
      case "@top_srcdir":
        return TOP_SRCDIR;
      case "@builddir":
        return BUILDDIR;
      default:
        return new Anchor(name);
    }
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Anchor other && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
