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

import org.kiln.expr.BoolValueExpr;
import org.kiln.expr.Expr;
import org.kiln.expr.IfExpr;
import org.kiln.expr.LiteralExpr;

/** Boolean values and conditions. */
public final class BoolType extends Type {
  public static final BoolType INSTANCE = new BoolType();

  private BoolType() {
    super("bool");
  }

  /** Converts the literals "true" and "false" into boolean values. */
  @Override
  public Expr normalize(Expr e) {
    if (e instanceof LiteralExpr literal) {
      switch (literal.value) {
        case "true":
          return new BoolValueExpr(true, e.pos);
        case "false":
          return new BoolValueExpr(false, e.pos);
        default:
          return e;
      }
    } else if (e instanceof IfExpr ifExpr) {
      Expr yes = normalize(ifExpr.yes);
      Expr no = normalize(ifExpr.no);
      if (yes != ifExpr.yes || no != ifExpr.no) {
        return new IfExpr(ifExpr.cond, yes, no, e.pos);
      }
    }
    return e;
  }

  @Override
  protected void validateValue(Expr e) {
    switch (e.kind()) {
      case BOOL_VALUE, BOOL -> {}
      case LITERAL -> throw error(e, "\"%s\" is not a valid boolean", ((LiteralExpr) e).value);
      default -> throw error(e, "%s is not a valid boolean expression", e);
    }
  }
}
