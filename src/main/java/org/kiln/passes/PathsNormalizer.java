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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.kiln.ContextError;
import org.kiln.expr.Anchor;
import org.kiln.expr.Expr;
import org.kiln.expr.ExprScanner;
import org.kiln.expr.Exprs;
import org.kiln.expr.LiteralExpr;
import org.kiln.expr.PathExpr;
import org.kiln.ext.Toolset;
import org.kiln.model.ModelPart;
import org.kiln.model.Module;
import org.kiln.model.Project;
import org.kiln.model.Target;
import org.kiln.model.Variable;

/**
 * Rewrites paths so that they mean the same thing wherever they are used. Paths relative to
 * {@code @srcdir} are rewritten relative to {@code @top_srcdir}; paths relative to {@code
 * @builddir} are translated in a toolset-specific way. Without this, a path variable defined in
 * one module would point somewhere else when referenced from another module.
 *
 * <p>{@link #setContext} selects the project, a module or a target before visiting expressions;
 * {@code @srcdir} paths need a module and {@code @builddir} paths need a target. Paths are
 * modified in place.
 *
 * <p>A PathsNormalizer caches the source directory prefix of each module and the build directory
 * of each target, so an instance must only be used for a single run over a single model.
 */
final class PathsNormalizer extends ExprScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /**
   * Normalizes the paths in all variables of the project. {@code @builddir} paths are left alone if
   * {@code toolset} is null. Project-level variables belong to no module, so they may only hold
   * paths that are already anchored elsewhere.
   *
   * @throws ContextError for an {@code @srcdir} path in a project-level variable, or a {@code
   *     @builddir} path outside of a target
   */
  static void apply(Project project, @Nullable Toolset toolset) {
    PathsNormalizer normalizer = new PathsNormalizer(toolset);
    normalizer.setContext(project);
    visitValues(normalizer, project.variables());
    for (Module module : project.modules()) {
      normalizer.setContext(module);
      visitValues(normalizer, module.variables());
      for (Target target : module.targets()) {
        normalizer.setContext(target);
        visitValues(normalizer, target.allVariables());
      }
    }
  }

  private static void visitValues(PathsNormalizer normalizer, Iterable<Variable> vars) {
    for (Variable var : vars) {
      normalizer.visit(var.value());
    }
  }

  private final @Nullable Toolset toolset;

  private @Nullable Module module;
  private @Nullable Target target;

  /**
   * Each module's directory relative to the top-level module's directory, split into components;
   * empty if they are the same directory.
   */
  private final Map<Module, ImmutableList<Expr>> srcPrefixes = new HashMap<>();

  private final Map<Target, PathExpr> builddirs = new HashMap<>();

  PathsNormalizer(@Nullable Toolset toolset) {
    this.toolset = toolset;
  }

  /**
   * Sets the part of the model that subsequently visited expressions belong to. Setting a target
   * also sets its module; setting the project clears both.
   */
  void setContext(ModelPart context) {
    if (context instanceof Target t) {
      module = t.module();
      target = t;
    } else if (context instanceof Module m) {
      module = m;
      target = null;
    } else {
      checkArgument(context instanceof Project, "paths can't be normalized in %s", context);
      module = null;
      target = null;
    }
  }

  @Override
  protected void path(PathExpr e) {
    visitChildren(e);
    if (e.anchor().equals(Anchor.BUILDDIR)) {
      if (target == null) {
        throw new ContextError("@builddir references are not allowed outside of targets", e.pos);
      }
      if (toolset != null) {
        PathExpr builddir = builddir(target);
        e.setAnchor(builddir.anchor());
        e.prependComponents(Exprs.copyPaths(builddir.components()));
      }
    }
    if (e.anchor().equals(Anchor.SRCDIR)) {
      if (module == null) {
        throw new ContextError("@srcdir paths can only be resolved within a module", e.pos);
      }
      e.prependComponents(srcPrefix(module));
      e.setAnchor(Anchor.TOP_SRCDIR);
    }
  }

  private ImmutableList<Expr> srcPrefix(Module module) {
    return srcPrefixes.computeIfAbsent(module, PathsNormalizer::computeSrcPrefix);
  }

  private static ImmutableList<Expr> computeSrcPrefix(Module module) {
    Path topSrcdir = sourceDir(module.project().topModule());
    Path srcdir = sourceDir(module);
    Path prefix = topSrcdir.relativize(srcdir);
    logger.atFine().log(
        "translating paths from %s with prefix \"%s\"", module.sourceFile(), prefix);
    if (prefix.toString().isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Expr> components = ImmutableList.builder();
    for (Path component : prefix) {
      components.add(new LiteralExpr(component.toString()));
    }
    return components.build();
  }

  /** Returns the absolute directory containing the module's source file. */
  private static Path sourceDir(Module module) {
    return Paths.get(module.sourceFile()).toAbsolutePath().normalize().getParent();
  }

  private PathExpr builddir(Target target) {
    return builddirs.computeIfAbsent(
        target,
        t -> {
          PathExpr result = toolset.getBuilddirFor(t);
          checkState(
              !result.anchor().equals(Anchor.BUILDDIR),
              "toolset %s returned a @builddir-relative build directory for %s",
              toolset.name(),
              t);
          logger.atFine().log("translating @builddir paths of %s into %s", t, result);
          return result;
        });
  }
}
