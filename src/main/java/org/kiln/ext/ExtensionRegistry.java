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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.kiln.KilnError;

/**
 * The implementations of one kind of extension, keyed by name.
 *
 * <p>Implementations are registered as factories. The first {@link #get} for a name creates the
 * instance; every later call for that name returns the same instance.
 */
public final class ExtensionRegistry<E extends Extension> {

  /** A description of the extension kind used in error messages, e.g. "toolset". */
  private final String kind;

  private final Map<String, Supplier<? extends E>> factories = new LinkedHashMap<>();
  private final Map<String, E> instances = new HashMap<>();

  public ExtensionRegistry(String kind) {
    this.kind = kind;
  }

  /**
   * Registers an implementation. Throws an IllegalArgumentException if another implementation has
   * already been registered with the same name.
   */
  @CanIgnoreReturnValue
  public ExtensionRegistry<E> register(String name, Supplier<? extends E> factory) {
    checkNotNull(factory);
    checkArgument(
        !factories.containsKey(name), "conflicting implementations for %s \"%s\"", kind, name);
    factories.put(name, factory);
    return this;
  }

  /** Registers an already-constructed implementation under its own name. */
  @CanIgnoreReturnValue
  public ExtensionRegistry<E> register(E instance) {
    register(instance.name(), () -> instance);
    return this;
  }

  /** Returns true if an implementation with the given name has been registered. */
  public boolean contains(String name) {
    return factories.containsKey(name);
  }

  /** Returns the implementation with the given name. Throws a KilnError if there is none. */
  public E get(String name) {
    Supplier<? extends E> factory = factories.get(name);
    if (factory == null) {
      throw KilnError.error(null, "unknown %s \"%s\"", kind, name);
    }
    return instances.computeIfAbsent(
        name,
        n -> {
          E instance = factory.get();
          checkState(
              instance.name().equals(n),
              "%s registered as \"%s\" is named \"%s\"",
              kind,
              n,
              instance.name());
          return instance;
        });
  }

  /** Returns the names of all registered implementations, in registration order. */
  public ImmutableSet<String> allNames() {
    return ImmutableSet.copyOf(factories.keySet());
  }

  /** Returns instances of all registered implementations, in registration order. */
  public ImmutableList<E> all() {
    return factories.keySet().stream().map(this::get).collect(ImmutableList.toImmutableList());
  }
}
