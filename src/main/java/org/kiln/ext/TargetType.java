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

import com.google.common.collect.ImmutableList;
import org.kiln.model.Property;

/** Describes a kind of target (executable, library, ...) and the properties it supports. */
public interface TargetType extends Extension {

  /** Returns the properties supported on targets of this type. */
  ImmutableList<Property> properties();
}
