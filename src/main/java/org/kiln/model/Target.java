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

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import org.jspecify.annotations.Nullable;
import org.kiln.ext.TargetType;
import org.kiln.ext.Toolset;

/** A target is a single thing to build (an executable, a library, ...) within a module. */
public final class Target extends ModelPart {

  private final Module module;
  private final String name;
  private final @Nullable TargetType type;

  Target(Module module, String name, @Nullable TargetType type) {
    super(module);
    this.module = module;
    this.name = name;
    this.type = type;
  }

  @Override
  public Project project() {
    return module.project();
  }

  public Module module() {
    return module;
  }

  public String name() {
    return name;
  }

  /** Returns this target's type, or null if it has none (e.g. in tests). */
  public @Nullable TargetType type() {
    return type;
  }

  /** Returns all variables defined on this target. */
  public Collection<Variable> allVariables() {
    return variables();
  }

  @Override
  ImmutableList<Property> enumerateProperties(@Nullable Toolset toolset) {
    ImmutableList.Builder<Property> builder = ImmutableList.builder();
    if (type != null) {
      builder.addAll(type.properties());
    }
    return builder.addAll(super.enumerateProperties(toolset)).build();
  }

  @Override
  public String toString() {
    return "target \"" + name + "\"";
  }
}
