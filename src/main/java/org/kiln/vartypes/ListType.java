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

import com.google.common.collect.ImmutableList;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;
import org.kiln.expr.ListExpr;

/** A list of values of some item type. */
public final class ListType extends Type {
  public final Type itemType;

  public ListType(Type itemType) {
    super("list of " + itemType.name);
    this.itemType = itemType;
  }

  /**
   * Normalizes each item of a list. Any other value becomes a single-item list, except null,
   * references (which may refer to a whole list), and conditionals, whose branches are normalized
   * instead.
   */
  @Override
  public Expr normalize(Expr e) {
    switch (e.kind()) {
      case LIST -> {
        ListExpr list = (ListExpr) e;
        ImmutableList<Expr> items =
            list.items.stream().map(this::normalizeItem).collect(ImmutableList.toImmutableList());
        boolean changed = false;
        for (int i = 0; i < items.size(); i++) {
          changed |= items.get(i) != list.items.get(i);
        }
        return changed ? new ListExpr(items, e.pos) : e;
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
      case NULL, REFERENCE -> {
        return e;
      }
      default -> {
        return new ListExpr(ImmutableList.of(itemType.normalize(e)), e.pos);
      }
    }
  }

  private Expr normalizeItem(Expr item) {
    // A reference in a list may expand to a whole list, so it's left for validation to sort out.
    return (item.kind() == Expr.Kind.REFERENCE) ? item : itemType.normalize(item);
  }

  @Override
  protected void validateValue(Expr e) {
    if (e.kind() != Expr.Kind.LIST) {
      throw error(e, "expected a list, got %s", e);
    }
    for (Expr item : ((ListExpr) e).items) {
      if (item.kind() == Expr.Kind.REFERENCE) {
        // Either a single item or a list that's spliced in.
        validate(item);
      } else {
        itemType.validate(item);
      }
    }
  }

  /** A list may refer to another list, or to a single value of the item type. */
  @Override
  protected void validateReferenced(Expr value) {
    switch (value.kind()) {
      case LIST, IF, NULL, REFERENCE -> validate(value);
      default -> itemType.validate(value);
    }
  }
}
