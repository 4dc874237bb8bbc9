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
import org.kiln.expr.Anchor;
import org.kiln.expr.PathExpr;
import org.kiln.model.Property;
import org.kiln.model.Target;

/**
 * A Toolset produces the output (makefiles or project files) for one family of build tools. The
 * analysis passes only need to know where each target's build directory is; generating the output
 * happens downstream.
 */
public interface Toolset extends Extension {

  /**
   * Returns the build directory to use for {@code target}. The result must not be anchored at
   * {@link Anchor#BUILDDIR}; it is usually anchored at {@link Anchor#TOP_SRCDIR} or at an anchor
   * specific to this toolset.
   */
  PathExpr getBuilddirFor(Target target);

  /**
   * Returns the properties this toolset adds to every part of the model (the project, each module
   * and each target).
   */
  default ImmutableList<Property> properties() {
    return ImmutableList.of();
  }
}
