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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.kiln.KilnError;
import org.kiln.ext.Toolset;

/**
 * A ModelPart is a lexical scope of the model (the project, a module, or a target) with its own
 * table of variables.
 *
 * <p>Variable lookup is lexical: a name not found in a part's own table is looked up in its parent
 * (a target's parent is its module, a module's parent is the project).
 */
public abstract class ModelPart {

  private final @Nullable ModelPart parent;

  /** This part's own variables, in declaration order. */
  private final Map<String, Variable> variables = new LinkedHashMap<>();

  ModelPart(@Nullable ModelPart parent) {
    this.parent = parent;
  }

  /** Returns the enclosing part, or null for the project. */
  public @Nullable ModelPart parent() {
    return parent;
  }

  /** Returns the project this part belongs to. */
  public abstract Project project();

  /** Returns this part's own variables, in declaration order. */
  public Collection<Variable> variables() {
    return Collections.unmodifiableCollection(variables.values());
  }

  /**
   * Returns the variable with the given name visible from this part (defined here or in an
   * enclosing part), or null if there is none.
   */
  public @Nullable Variable getVariable(String name) {
    for (ModelPart part = this; part != null; part = part.parent) {
      Variable result = part.variables.get(name);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /** Returns the variable with the given name defined in this part itself, or null. */
  public @Nullable Variable getLocalVariable(String name) {
    return variables.get(name);
  }

  /** Adds a variable to this part. There must not already be one with the same name. */
  @CanIgnoreReturnValue
  public Variable addVariable(Variable var) {
    checkArgument(
        !variables.containsKey(var.name), "variable \"%s\" already defined in %s", var.name, this);
    variables.put(var.name, var);
    return var;
  }

  /**
   * Returns the properties that apply to this part: those of the toolset, which apply to every
   * part of the model. Targets add the properties of their target type.
   */
  ImmutableList<Property> enumerateProperties(@Nullable Toolset toolset) {
    return (toolset == null) ? ImmutableList.of() : toolset.properties();
  }

  /**
   * Creates a variable holding the default value for each applicable property that hasn't been
   * given a value explicitly.
   *
   * @throws KilnError if a read-only property was given a value other than its default
   */
  public void makeVariablesForMissingProps(@Nullable Toolset toolset) {
    for (Property prop : enumerateProperties(toolset)) {
      Variable existing = variables.get(prop.name);
      if (existing == null) {
        addVariable(Variable.fromProperty(prop, prop.defaultExpr(this)));
      } else if (prop.readonly && !existing.value().equals(prop.defaultExpr(this))) {
        throw KilnError.error(
            existing.pos, "property \"%s\" of %s is read-only and can't be set", prop.name, this);
      }
    }
  }
}
