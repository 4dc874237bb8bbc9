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

package org.kiln.ext;

/**
 * The registries for every kind of extension. A process normally creates one Extensions instance
 * at startup, registers the available implementations, and passes it to whatever needs to look
 * them up.
 */
public final class Extensions {
  private final ExtensionRegistry<Toolset> toolsets = new ExtensionRegistry<>("toolset");
  private final ExtensionRegistry<TargetType> targetTypes =
      new ExtensionRegistry<>("target type");

  public ExtensionRegistry<Toolset> toolsets() {
    return toolsets;
  }

  public ExtensionRegistry<TargetType> targetTypes() {
    return targetTypes;
  }
}
