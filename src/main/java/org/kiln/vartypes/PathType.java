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

package org.kiln.vartypes;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.kiln.expr.Anchor;
import org.kiln.expr.ConcatExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;
import org.kiln.expr.LiteralExpr;
import org.kiln.expr.PathExpr;

/**
 * File system paths. Normalization turns a path written as a string (e.g. {@code
 * src/$(name).c}) into a {@link PathExpr}; a path without an explicit anchor is relative to
 * {@link Anchor#SRCDIR}.
 */
public final class PathType extends Type {
  public static final PathType INSTANCE = new PathType();

  private static final Splitter SLASH = Splitter.on('/');

  private PathType() {
    super("path");
  }

  @Override
  public Expr normalize(Expr e) {
    switch (e.kind()) {
      case LITERAL, CONCAT -> {
        return parsePath(e);
      }
      case IF -> {
        IfExpr ifExpr = (IfExpr) e;
        Expr yes = normalize(ifExpr.yes);
        Expr no = normalize(ifExpr.no);
        if (yes != ifExpr.yes || no != ifExpr.no) {
          return new IfExpr(ifExpr.cond, yes, no, e.pos);
        }
        return e;
      }
      default -> {
        return e;
      }
    }
  }

  /**
   * Splits a literal or concatenation into path components at each "/". Non-literal parts of a
   * concatenation stay in the component they appear in.
   */
  private static PathExpr parsePath(Expr e) {
    List<Expr> parts = (e instanceof ConcatExpr concat) ? concat.items : ImmutableList.of(e);
    List<Expr> components = new ArrayList<>();
    List<Expr> current = new ArrayList<>();
    for (Expr part : parts) {
      if (part instanceof LiteralExpr literal) {
        List<String> pieces = SLASH.splitToList(literal.value);
        for (int i = 0; i < pieces.size(); i++) {
          if (i > 0) {
            addComponent(components, current);
            current = new ArrayList<>();
          }
          if (!pieces.get(i).isEmpty()) {
            current.add(new LiteralExpr(pieces.get(i), part.pos));
          }
        }
      } else {
        current.add(part);
      }
    }
    addComponent(components, current);
    Anchor anchor = Anchor.SRCDIR;
    if (!components.isEmpty()
        && components.get(0) instanceof LiteralExpr first
        && first.value.startsWith("@")) {
      anchor = Anchor.named(first.value);
      components.remove(0);
    }
    return new PathExpr(anchor, components, e.pos);
  }

  private static void addComponent(List<Expr> components, List<Expr> parts) {
    if (parts.size() == 1) {
      components.add(parts.get(0));
    } else if (parts.size() > 1) {
      components.add(new ConcatExpr(parts, parts.get(0).pos));
    }
  }

  @Override
  protected void validateValue(Expr e) {
    if (e.kind() != Expr.Kind.PATH) {
      throw error(e, "%s is not a valid path", e);
    }
  }
}
