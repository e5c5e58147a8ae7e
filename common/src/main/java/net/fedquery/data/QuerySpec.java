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
package net.fedquery.data;

import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * A single query within a {@link QueryRequest}. Only the fields the parser
 * needs are typed: the reference ID, the data source (modern reference or the
 * deprecated name and numeric ID), and an optional time range override.
 * Everything else the client sent is kept, in order, in a pass-through
 * property map and serialized back out unchanged.
 * <p>
 * On the wire the deprecated name is sent as a plain string in the
 * {@code datasource} field while the modern reference is an object with
 * {@code type} and {@code uid}.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "refId", "datasource", "datasourceId", "timeRange" })
public class QuerySpec {
  public static final String REF_ID_KEY = "refId";
  public static final String DATASOURCE_KEY = "datasource";
  public static final String DATASOURCE_ID_KEY = "datasourceId";
  public static final String TIME_RANGE_KEY = "timeRange";

  /** Keys that are parsed into typed fields and never kept as properties. */
  public static final Set<String> RESERVED_KEYS = ImmutableSet.of(
      REF_ID_KEY, DATASOURCE_KEY, DATASOURCE_ID_KEY, TIME_RANGE_KEY);

  /** The reference ID, never null. May be empty. */
  private final String ref_id;

  /** The modern data source reference. May be null. */
  private final DataSourceRef datasource;

  /** The deprecated data source name. May be null. */
  private final String datasource_name;

  /** The deprecated numeric data source ID, 0 when absent. */
  private final long datasource_id;

  /** An optional per-query time range. */
  private final TimeRange time_range;

  /** The remaining, opaque, fields. */
  private final Map<String, Object> properties;

  protected QuerySpec(final Builder builder) {
    ref_id = Strings.nullToEmpty(builder.ref_id);
    datasource = builder.datasource;
    datasource_name = builder.datasource_name;
    datasource_id = builder.datasource_id;
    time_range = builder.time_range;
    properties = builder.properties == null ?
        Collections.<String, Object>emptyMap() :
          Collections.unmodifiableMap(Maps.newLinkedHashMap(builder.properties));
  }

  /** @return The reference ID, never null. */
  @JsonProperty(REF_ID_KEY)
  public String getRefId() {
    return ref_id;
  }

  /** @return The modern data source reference, may be null. */
  @JsonIgnore
  public DataSourceRef getDataSource() {
    return datasource;
  }

  /** @return The deprecated data source name, may be null. */
  @JsonIgnore
  public String getDataSourceName() {
    return datasource_name;
  }

  /** @return The deprecated numeric data source ID or 0 if not set. */
  @JsonProperty(DATASOURCE_ID_KEY)
  @JsonInclude(Include.NON_DEFAULT)
  public long getDataSourceId() {
    return datasource_id;
  }

  /** @return The per-query time range, may be null. */
  @JsonProperty(TIME_RANGE_KEY)
  public TimeRange getTimeRange() {
    return time_range;
  }

  /** @return The pass-through properties, never null. */
  @JsonAnyGetter
  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * @param key A non-null key.
   * @return The property value or null if not present.
   */
  public Object getProperty(final String key) {
    return properties.get(key);
  }

  /**
   * @param key A non-null key.
   * @return The property as a string if it is one, null otherwise.
   */
  public String getStringProperty(final String key) {
    final Object value = properties.get(key);
    return value instanceof String ? (String) value : null;
  }

  /** @return True if the deprecated name or numeric ID was given. */
  public boolean hasDeprecatedFields() {
    return datasource_id != 0 || !Strings.isNullOrEmpty(datasource_name);
  }

  /** @return The data source in the shape it takes on the wire. */
  @JsonProperty(DATASOURCE_KEY)
  Object serdesDataSource() {
    if (datasource != null) {
      return datasource;
    }
    return datasource_name;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QuerySpec other = (QuerySpec) o;
    return Objects.equal(ref_id, other.ref_id)
        && Objects.equal(datasource, other.datasource)
        && Objects.equal(datasource_name, other.datasource_name)
        && datasource_id == other.datasource_id
        && Objects.equal(time_range, other.time_range)
        && Objects.equal(properties, other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(ref_id, datasource, datasource_name,
        datasource_id, time_range, properties);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("refId=")
        .append(ref_id)
        .append(", datasource=[")
        .append(datasource)
        .append("], datasourceName=")
        .append(datasource_name)
        .append(", datasourceId=")
        .append(datasource_id)
        .append(", timeRange=[")
        .append(time_range)
        .append("], properties=")
        .append(properties)
        .toString();
  }

  /**
   * Parses the query from the generic map Jackson hands us so that every
   * unknown field is retained.
   * @param map A non-null map of fields.
   * @return The parsed query.
   * @throws IllegalArgumentException if a typed field had the wrong shape.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static QuerySpec fromMap(final Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    final Builder builder = newBuilder();
    for (final Entry<String, Object> entry : map.entrySet()) {
      final Object value = entry.getValue();
      switch (entry.getKey()) {
      case REF_ID_KEY:
        builder.setRefId(value == null ? null : value.toString());
        break;
      case DATASOURCE_KEY:
        if (value == null) {
          break;
        }
        if (value instanceof String) {
          builder.setDataSourceName((String) value);
        } else if (value instanceof Map) {
          final Map<?, ?> ref = (Map<?, ?>) value;
          builder.setDataSource(new DataSourceRef(
              stringOrNull(ref.get("type")),
              stringOrNull(ref.get("uid"))));
        } else {
          throw new IllegalArgumentException("Invalid datasource: " + value);
        }
        break;
      case DATASOURCE_ID_KEY:
        if (value == null) {
          break;
        }
        if (value instanceof Number) {
          builder.setDataSourceId(((Number) value).longValue());
        } else {
          try {
            builder.setDataSourceId(Long.parseLong(value.toString()));
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid datasourceId: "
                + value, e);
          }
        }
        break;
      case TIME_RANGE_KEY:
        if (value == null) {
          break;
        }
        if (!(value instanceof Map)) {
          throw new IllegalArgumentException("Invalid timeRange: " + value);
        }
        final Map<?, ?> range = (Map<?, ?>) value;
        builder.setTimeRange(new TimeRange(
            stringOrNull(range.get("from")),
            stringOrNull(range.get("to"))));
        break;
      default:
        builder.addProperty(entry.getKey(), value);
      }
    }
    return builder.build();
  }

  private static String stringOrNull(final Object value) {
    return value == null ? null : value.toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a query into a new builder.
   * @param query A non-null query to copy.
   * @return A builder populated from the query.
   */
  public static Builder newBuilder(final QuerySpec query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    final Builder builder = new Builder()
        .setRefId(query.ref_id)
        .setDataSource(query.datasource)
        .setDataSourceName(query.datasource_name)
        .setDataSourceId(query.datasource_id)
        .setTimeRange(query.time_range);
    for (final Entry<String, Object> entry : query.properties.entrySet()) {
      builder.addProperty(entry.getKey(), entry.getValue());
    }
    return builder;
  }

  public static final class Builder {
    private String ref_id;
    private DataSourceRef datasource;
    private String datasource_name;
    private long datasource_id;
    private TimeRange time_range;
    private Map<String, Object> properties;

    public Builder setRefId(final String ref_id) {
      this.ref_id = ref_id;
      return this;
    }

    public Builder setDataSource(final DataSourceRef datasource) {
      this.datasource = datasource;
      return this;
    }

    public Builder setDataSource(final String type, final String uid) {
      datasource = new DataSourceRef(type, uid);
      return this;
    }

    public Builder setDataSourceName(final String datasource_name) {
      this.datasource_name = datasource_name;
      return this;
    }

    public Builder setDataSourceId(final long datasource_id) {
      this.datasource_id = datasource_id;
      return this;
    }

    public Builder setTimeRange(final TimeRange time_range) {
      this.time_range = time_range;
      return this;
    }

    public Builder setTimeRange(final String from, final String to) {
      time_range = new TimeRange(from, to);
      return this;
    }

    /**
     * Adds an opaque property.
     * @param key A non-null and non-empty key that is not one of the
     * {@link QuerySpec#RESERVED_KEYS}.
     * @param value The value, may be null.
     * @return The builder.
     * @throws IllegalArgumentException if the key was null, empty or reserved.
     */
    public Builder addProperty(final String key, final Object value) {
      if (Strings.isNullOrEmpty(key)) {
        throw new IllegalArgumentException("Property key cannot be null "
            + "or empty.");
      }
      if (RESERVED_KEYS.contains(key)) {
        throw new IllegalArgumentException("Property key [" + key
            + "] is reserved.");
      }
      if (properties == null) {
        properties = Maps.newLinkedHashMap();
      }
      properties.put(key, value);
      return this;
    }

    public QuerySpec build() {
      return new QuerySpec(this);
    }
  }
}
