//
// Copyright 2026 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.google.privacy.dpaccess;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the private data of one participant. Each piece of data is bound to a name, and can only be
 * read through the {@link DataAccessDefinition} configured for that name; the raw values never
 * leave the node otherwise.
 *
 * <p>The types of the data and of its access definition are not checked against each other when
 * they are bound. Numerical mechanisms accept both a {@link Number} and a {@code double[]} and
 * release a value of the same shape. Any other mismatch surfaces as a {@link ClassCastException}
 * at query time.
 *
 * <p>Note: this class is not thread-safe.
 */
public class DataNode {
  private static final Logger logger = LoggerFactory.getLogger(DataNode.class);

  private final Map<String, Object> privateData = new HashMap<>();
  private final Map<String, DataAccessDefinition<?, ?>> accessDefinitions = new HashMap<>();

  /**
   * Binds {@code data} to {@code name}. A value already bound to {@code name} is replaced; the
   * access definition configured for {@code name}, if any, is kept.
   */
  public void setPrivateData(String name, Object data) {
    checkNotNull(name, "name must not be null.");
    checkNotNull(data, "data must not be null.");
    if (privateData.put(name, data) != null) {
      logger.debug("Replaced private data {}", name);
    }
  }

  /** Configures how the data bound to {@code name} is read, replacing any previous definition. */
  public void configureDataAccess(String name, DataAccessDefinition<?, ?> definition) {
    checkNotNull(name, "name must not be null.");
    checkNotNull(definition, "definition must not be null.");
    accessDefinitions.put(name, definition);
    logger.debug("Configured {} for private data {}", definition.getClass().getSimpleName(), name);
  }

  /**
   * Returns the release of the data bound to {@code name} by its configured access definition.
   *
   * @throws IllegalArgumentException if no data is bound to {@code name} or no access definition
   *     is configured for it.
   * @throws ExceededPrivacyBudgetException if the access definition enforces a privacy budget that
   *     is exhausted.
   */
  public <R> R query(String name) {
    return query(name, null);
  }

  /**
   * Returns the release of the data bound to {@code name}, passing {@code override} to the
   * configured access definition. Only definitions that accept a per-query definition, such as
   * {@link AdaptiveDifferentialPrivacy}, can be given a non-null {@code override}.
   *
   * @throws IllegalArgumentException if no data is bound to {@code name}, if no access definition
   *     is configured for it, or if the configured definition rejects {@code override}.
   * @throws ExceededPrivacyBudgetException if the access definition enforces a privacy budget that
   *     is exhausted.
   */
  public <R> R query(String name, @Nullable DataAccessDefinition<?, ?> override) {
    DataAccessDefinition<Object, R> definition = accessDefinition(name);
    if (override == null) {
      return DataAccessDefinitions.applyUntyped(definition, data(name));
    }
    return definition.apply(data(name), castDefinition(override));
  }

  /**
   * Replaces the data bound to {@code name} by the result of {@code transformation}, without
   * releasing it.
   *
   * @throws IllegalArgumentException if no data is bound to {@code name}.
   */
  public <T> void applyDataTransformation(String name, Query<T, ? extends T> transformation) {
    checkNotNull(transformation, "transformation must not be null.");
    @SuppressWarnings("unchecked") // The caller asserts the type of the bound data.
    T data = (T) data(name);
    privateData.put(name, checkNotNull(transformation.get(data), "Transformed data is null."));
    logger.debug("Transformed private data {}", name);
  }

  private Object data(String name) {
    Object data = privateData.get(name);
    checkArgument(data != null, "No private data bound to %s.", name);
    return data;
  }

  private <R> DataAccessDefinition<Object, R> accessDefinition(String name) {
    // Checked first so that an unknown name is reported as such.
    data(name);
    DataAccessDefinition<Object, R> definition = castDefinition(accessDefinitions.get(name));
    checkArgument(definition != null, "No data access definition configured for %s.", name);
    return definition;
  }

  @SuppressWarnings("unchecked") // Bindings are not typed, see the class documentation.
  @Nullable
  private static <R> DataAccessDefinition<Object, R> castDefinition(
      @Nullable DataAccessDefinition<?, ?> definition) {
    return (DataAccessDefinition<Object, R>) definition;
  }
}
