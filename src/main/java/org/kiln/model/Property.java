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

package org.kiln.model;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.kiln.KilnError;
import org.kiln.expr.Expr;
import org.kiln.expr.Exprs;
import org.kiln.expr.NullExpr;
import org.kiln.vartypes.Type;

/**
 * Properties describe the variables of targets (and other model parts) that have special meaning
 * to the toolset. Unlike free-form variables, properties always have a declared type, and may have
 * a default value that is used if the build description doesn't set them.
 *
 * <p>A default is either a fixed expression or a function computing one for a given model part
 * (e.g. a target's output name derived from the target's name).
 */
public final class Property {
  public final String name;
  public final Type type;

  /** Read-only properties can only have their default value. */
  public final boolean readonly;

  public final @Nullable String doc;

  private final @Nullable Function<ModelPart, Expr> defaultFn;

  private Property(
      String name,
      Type type,
      @Nullable Function<ModelPart, Expr> defaultFn,
      boolean readonly,
      @Nullable String doc) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
    this.defaultFn = defaultFn;
    this.readonly = readonly;
    this.doc = doc;
  }

  /** Creates a property with no default value. */
  public Property(String name, Type type) {
    this(name, type, (Function<ModelPart, Expr>) null, false, null);
  }

  /** Creates a property with a fixed default value (which may be null). */
  public Property(
      String name, Type type, @Nullable Expr defaultValue, boolean readonly, @Nullable String doc) {
    this(name, type, constant(defaultValue), readonly, doc);
  }

  private static @Nullable Function<ModelPart, Expr> constant(@Nullable Expr value) {
    return (value == null) ? null : part -> value;
  }

  /** Creates a property whose default value is computed for each model part it applies to. */
  public static Property withComputedDefault(
      String name,
      Type type,
      Function<ModelPart, Expr> defaultFn,
      boolean readonly,
      @Nullable String doc) {
    return new Property(name, type, checkNotNull(defaultFn), readonly, doc);
  }

  /**
   * Returns the default value of this property for {@code forPart}. Always returns an expression,
   * which is a {@link NullExpr} if the property has no default.
   *
   * <p>A default function that fails is reported as a {@link KilnError} naming the property and
   * {@code forPart}.
   */
  public Expr defaultExpr(ModelPart forPart) {
    if (defaultFn == null) {
      return new NullExpr();
    }
    Expr result;
    try {
      result = defaultFn.apply(forPart);
    } catch (KilnError e) {
      throw e;
    } catch (RuntimeException e) {
      throw new KilnError(
          String.format(
              "cannot compute default value of property \"%s\" of %s: %s",
              name, forPart, e.getMessage()),
          null,
          e);
    }
    if (result == null) {
      throw new KilnError(
          String.format("default value of property \"%s\" of %s is null", name, forPart), null);
    }
    // The same fixed default may end up in many variables.
    return Exprs.copyPaths(result);
  }

  @Override
  public String toString() {
    return name + " (" + type + ")";
  }
}
