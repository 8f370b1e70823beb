/*
 * Copyright 2025 AxonOps
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

package com.axonops.regexpextract.engine;

import com.axonops.regexpextract.api.RegexpExtract;
import com.axonops.regexpextract.api.ScalarFunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-to-function lookup for the host engine.
 *
 * <p>Names and aliases are matched case-insensitively. Registering a function under a name that
 * is already taken replaces the previous function for that name.
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public final class FunctionRegistry {
  private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

  private final Map<String, ScalarFunction> functions = new ConcurrentHashMap<>();

  /**
   * Creates a registry holding the built-in functions ({@code regexp_extract} with default
   * configuration).
   */
  public static FunctionRegistry withDefaults() {
    FunctionRegistry registry = new FunctionRegistry();
    registry.register(new RegexpExtract());
    return registry;
  }

  /**
   * Registers a function under its name and every alias.
   *
   * @param function the function to register
   */
  public void register(ScalarFunction function) {
    Objects.requireNonNull(function, "function cannot be null");
    List<String> keys = new ArrayList<>();
    keys.add(function.name());
    keys.addAll(function.aliases());

    for (String key : keys) {
      ScalarFunction previous = functions.put(normalize(key), function);
      if (previous != null && previous != function) {
        logger.warn("regexp_extract: Function '{}' re-registered - replacing previous definition", key);
      }
    }
    logger.info("regexp_extract: Registered function '{}' - aliases: {}", function.name(), function.aliases());
  }

  /**
   * Looks up a function by name or alias.
   *
   * @param name function name, any case
   * @return the function, or empty if none is registered under that name
   */
  public Optional<ScalarFunction> lookup(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(functions.get(normalize(name)));
  }

  public boolean contains(String name) {
    return lookup(name).isPresent();
  }

  /** Returns every registered name and alias, lower-cased and sorted. */
  public List<String> names() {
    return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(functions.keySet())));
  }

  private static String normalize(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
