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

package org.kiln.passes;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.kiln.Diagnostic;
import org.kiln.KilnError;
import org.kiln.ext.Extensions;
import org.kiln.ext.Toolset;
import org.kiln.model.Project;

/**
 * Runs the passes over a model in a fixed order:
 *
 * <ol>
 *   <li>{@link Passes#detectSelfReferences};
 *   <li>{@link Passes#detectUnusedVars} (unless disabled);
 *   <li>{@link Passes#normalizeAndValidateVars};
 *   <li>{@link Passes#normalizePaths};
 *   <li>{@link Passes#simplifyExprs} and {@link Passes#eliminateSuperfluousConditionals} (unless
 *       disabled).
 * </ol>
 *
 * Later passes depend on what earlier ones establish (e.g. simplification assumes there are no
 * cyclic references). The first {@link KilnError} aborts the run.
 *
 * <p>A Pipeline may be run on any number of models; it keeps no state between runs.
 */
public final class Pipeline {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final @Nullable Toolset toolset;
  private final boolean warnUnused;
  private final boolean simplify;

  private Pipeline(Builder builder) {
    if (builder.toolsetName == null) {
      toolset = null;
    } else {
      checkState(builder.extensions != null, "a toolset name requires extensions()");
      toolset = builder.extensions.toolsets().get(builder.toolsetName);
    }
    this.warnUnused = builder.warnUnused;
    this.simplify = builder.simplify;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the toolset paths are resolved for, or null if there is none. */
  public @Nullable Toolset toolset() {
    return toolset;
  }

  /**
   * Runs all passes over {@code project}, modifying it in place.
   *
   * @return the warnings reported along the way
   * @throws KilnError if the model is invalid
   */
  @CanIgnoreReturnValue
  public ImmutableList<Diagnostic> run(Project project) {
    logger.atFine().log(
        "running passes (toolset: %s)", (toolset == null) ? "none" : toolset.name());
    Passes.detectSelfReferences(project);
    ImmutableList<Diagnostic> warnings =
        warnUnused ? Passes.detectUnusedVars(project) : ImmutableList.of();
    Passes.normalizeAndValidateVars(project);
    Passes.normalizePaths(project, toolset);
    if (simplify) {
      Passes.simplifyExprs(project);
      Passes.eliminateSuperfluousConditionals(project);
    }
    return warnings;
  }

  /** Configures a Pipeline. */
  public static final class Builder {
    private @Nullable Extensions extensions;
    private @Nullable String toolsetName;
    private boolean warnUnused = true;
    private boolean simplify = true;

    private Builder() {}

    /** Sets the extensions used to look up the toolset. */
    @CanIgnoreReturnValue
    public Builder extensions(Extensions extensions) {
      this.extensions = extensions;
      return this;
    }

    /**
     * Sets the name of the toolset to generate output for. If none is set, {@code @builddir} paths
     * are left for toolset-specific code generation to resolve.
     */
    @CanIgnoreReturnValue
    public Builder toolset(String name) {
      this.toolsetName = name;
      return this;
    }

    /** Whether to report unused variables; defaults to true. */
    @CanIgnoreReturnValue
    public Builder warnUnused(boolean warnUnused) {
      this.warnUnused = warnUnused;
      return this;
    }

    /** Whether to run the simplification passes; defaults to true. */
    @CanIgnoreReturnValue
    public Builder simplify(boolean simplify) {
      this.simplify = simplify;
      return this;
    }

    /**
     * Returns a new Pipeline. Throws a KilnError if the toolset isn't registered in the
     * extensions.
     */
    public Pipeline build() {
      return new Pipeline(this);
    }
  }
}
