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

import org.kiln.expr.ConcatExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;
import org.kiln.expr.ReferenceExpr;
import org.kiln.model.Variable;

/**
 * Strings. A string may be built by concatenation, and paths may be concatenated into it (e.g.
 * {@code -I$(includedir)}), but a string variable can't hold a list or a bare path.
 */
public final class StringType extends Type {
  public static final StringType INSTANCE = new StringType();

  private StringType() {
    super("string");
  }

  @Override
  protected void validateValue(Expr e) {
    switch (e.kind()) {
      case LITERAL -> {}
      case CONCAT -> {
        for (Expr item : ((ConcatExpr) e).items) {
          validateConcatItem(item);
        }
      }
      case LIST -> throw error(e, "expected a single string, got a list %s", e);
      case PATH -> throw error(e, "expected a string, got path %s", e);
      default -> throw error(e, "%s is not a valid string", e);
    }
  }

  /**
   * Checks one item of a concatenation. Paths are allowed here, whether written directly or held
   * by a referenced variable.
   */
  private void validateConcatItem(Expr item) {
    switch (item.kind()) {
      case PATH -> {}
      case REFERENCE -> {
        Variable var = ((ReferenceExpr) item).resolve();
        if (var != null) {
          validateConcatItem(var.value());
        }
      }
      case IF -> {
        IfExpr ifExpr = (IfExpr) item;
        validateConcatItem(ifExpr.yes);
        validateConcatItem(ifExpr.no);
      }
      default -> validate(item);
    }
  }
}
