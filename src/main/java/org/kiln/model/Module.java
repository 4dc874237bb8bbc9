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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.kiln.ext.TargetType;

/** A module corresponds to one build description file, and contains targets. */
public final class Module extends ModelPart {

  private final Project project;
  private final String sourceFile;
  private final Map<String, Target> targets = new LinkedHashMap<>();

  Module(Project project, String sourceFile) {
    super(project);
    this.project = project;
    this.sourceFile = sourceFile;
  }

  @Override
  public Project project() {
    return project;
  }

  /** Returns the path of the file this module was read from. */
  public String sourceFile() {
    return sourceFile;
  }

  /** Returns this module's targets, in declaration order. */
  public Collection<Target> targets() {
    return Collections.unmodifiableCollection(targets.values());
  }

  public @Nullable Target getTarget(String name) {
    return targets.get(name);
  }

  /** Creates a new target in this module. There must not already be one with the same name. */
  public Target addTarget(String name, @Nullable TargetType type) {
    checkArgument(!targets.containsKey(name), "target \"%s\" already defined in %s", name, this);
    Target target = new Target(this, name, type);
    targets.put(name, target);
    return target;
  }

  @Override
  public String toString() {
    return "module " + sourceFile;
  }
}
