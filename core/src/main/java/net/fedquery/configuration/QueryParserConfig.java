// This file is part of Fedquery.
// Copyright (C) 2026  The Fedquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.fedquery.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.fedquery.utils.JSON;
import net.fedquery.utils.YAML;

/**
 * Settings for building a query parser. Loaded from YAML or JSON with keys:
 * <ul>
 * <li>{@code sqlExpressionsEnabled} - whether SQL expressions are accepted.
 * Defaults to false.</li>
 * <li>{@code legacyTimeout} - an upper bound in milliseconds for each legacy
 * data source lookup. 0, the default, leaves the bound to the caller's
 * deadline.</li>
 * <li>{@code dataSources} - a list of {@link LegacyDataSourceEntry}s
 * backing the configured legacy retriever.</li>
 * </ul>
 * {@link #load()} reads the file named by the {@value #CONFIG_FILE_PROPERTY}
 * system property, falling back to the {@value #DEFAULT_RESOURCE} class path
 * resource and finally to the defaults.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = QueryParserConfig.Builder.class)
public class QueryParserConfig {
  private static final Logger LOG =
      LoggerFactory.getLogger(QueryParserConfig.class);

  /** System property naming a YAML or JSON config file. */
  public static final String CONFIG_FILE_PROPERTY = "fedquery.config";

  /** Class path resource consulted when the property is not set. */
  public static final String DEFAULT_RESOURCE = "fedquery.yaml";

  /** Gate for SQL expressions. */
  private final boolean sql_expressions_enabled;

  /** Per lookup timeout in ms, 0 for none. */
  private final long legacy_timeout;

  /** Statically configured legacy data sources. */
  private final List<LegacyDataSourceEntry> data_sources;

  protected QueryParserConfig(final Builder builder) {
    if (builder.legacyTimeout < 0) {
      throw new IllegalArgumentException("Legacy timeout cannot be "
          + "negative.");
    }
    sql_expressions_enabled = builder.sqlExpressionsEnabled;
    legacy_timeout = builder.legacyTimeout;
    if (builder.dataSources == null) {
      data_sources = Collections.emptyList();
    } else {
      for (int i = 0; i < builder.dataSources.size(); i++) {
        if (builder.dataSources.get(i) == null) {
          throw new IllegalArgumentException("Null data source at index " + i);
        }
        try {
          builder.dataSources.get(i).validate();
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Invalid data source at index "
              + i, e);
        }
      }
      data_sources = ImmutableList.copyOf(builder.dataSources);
    }
  }

  /** @return Whether or not SQL expressions are accepted. */
  public boolean isSqlExpressionsEnabled() {
    return sql_expressions_enabled;
  }

  /** @return The legacy lookup timeout in ms, 0 for none. */
  public long getLegacyTimeout() {
    return legacy_timeout;
  }

  /** @return The configured legacy data sources, never null. */
  public List<LegacyDataSourceEntry> getDataSources() {
    return data_sources;
  }

  /**
   * Loads the config from the file named by {@value #CONFIG_FILE_PROPERTY},
   * else the {@value #DEFAULT_RESOURCE} resource, else the defaults.
   * @return A non-null config.
   * @throws IllegalArgumentException if the file could not be read or parsed.
   */
  public static QueryParserConfig load() {
    final String file = System.getProperty(CONFIG_FILE_PROPERTY);
    if (!Strings.isNullOrEmpty(file)) {
      return fromFile(Paths.get(file));
    }

    final InputStream stream = QueryParserConfig.class.getClassLoader()
        .getResourceAsStream(DEFAULT_RESOURCE);
    if (stream == null) {
      LOG.info("No {} resource found, using the default parser config.",
          DEFAULT_RESOURCE);
      return newBuilder().build();
    }
    try {
      LOG.info("Loading parser config from resource {}", DEFAULT_RESOURCE);
      return YAML.parseToObject(stream, QueryParserConfig.class);
    } finally {
      try {
        stream.close();
      } catch (IOException e) {
        LOG.warn("Failed to close resource " + DEFAULT_RESOURCE, e);
      }
    }
  }

  /**
   * Loads the config from a file. Files ending in {@code .json} are parsed
   * as JSON, anything else as YAML.
   * @param path A non-null path.
   * @return The parsed config.
   * @throws IllegalArgumentException if the file could not be read or parsed.
   */
  public static QueryParserConfig fromFile(final Path path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    LOG.info("Loading parser config from file {}", path);
    try (final InputStream stream = Files.newInputStream(path)) {
      if (path.toString().toLowerCase().endsWith(".json")) {
        return JSON.parseToObject(stream, QueryParserConfig.class);
      }
      return YAML.parseToObject(stream, QueryParserConfig.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read config file: "
          + path, e);
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("sqlExpressionsEnabled=")
        .append(sql_expressions_enabled)
        .append(", legacyTimeout=")
        .append(legacy_timeout)
        .append(", dataSources=")
        .append(data_sources)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private boolean sqlExpressionsEnabled;
    @JsonProperty
    private long legacyTimeout;
    @JsonProperty
    private List<LegacyDataSourceEntry> dataSources;

    public Builder setSqlExpressionsEnabled(final boolean enabled) {
      sqlExpressionsEnabled = enabled;
      return this;
    }

    public Builder setLegacyTimeout(final long timeout) {
      legacyTimeout = timeout;
      return this;
    }

    public Builder setDataSources(final List<LegacyDataSourceEntry> entries) {
      dataSources = entries;
      return this;
    }

    public Builder addDataSource(final LegacyDataSourceEntry entry) {
      if (dataSources == null) {
        dataSources = Lists.newArrayList();
      }
      dataSources.add(entry);
      return this;
    }

    public QueryParserConfig build() {
      return new QueryParserConfig(this);
    }
  }
}
