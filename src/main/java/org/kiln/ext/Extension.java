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
 * An Extension is a named, pluggable implementation of some aspect of the build compiler, e.g. a
 * toolset or a target type. Each kind of extension has its own {@link ExtensionRegistry}.
 */
public interface Extension {
  /** Returns the user-visible name of this extension, e.g. the name used in target declarations. */
  String name();
}
