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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The root of the model: project-wide variables and the list of modules. */
public final class Project extends ModelPart {

  private final List<Module> modules = new ArrayList<>();

  public Project() {
    super(null);
  }

  @Override
  public Project project() {
    return this;
  }

  /** Returns all modules, in the order they were added; the first is the top-level module. */
  public List<Module> modules() {
    return Collections.unmodifiableList(modules);
  }

  /** Creates a new module read from the given source file and adds it to this project. */
  public Module addModule(String sourceFile) {
    Module module = new Module(this, sourceFile);
    modules.add(module);
    return module;
  }

  /** Returns the top-level module, i.e. the first one added. */
  public Module topModule() {
    checkState(!modules.isEmpty(), "project has no modules");
    return modules.get(0);
  }

  /**
   * Returns every variable in the model: the project's own, then for each module its variables
   * followed by those of each of its targets.
   */
  public ImmutableList<Variable> allVariables() {
    ImmutableList.Builder<Variable> builder = ImmutableList.builder();
    builder.addAll(variables());
    for (Module module : modules) {
      builder.addAll(module.variables());
      for (Target target : module.targets()) {
        builder.addAll(target.allVariables());
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "project";
  }
}
