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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.fedquery.data.DataSourceRef;

/**
 * A statically configured data source that can be addressed through the
 * deprecated name or numeric ID fields.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = LegacyDataSourceEntry.Builder.class)
public class LegacyDataSourceEntry {
  /** The deprecated numeric ID, 0 if the entry is only addressable by
   * name. */
  private final long id;

  /** The deprecated name, may be null. */
  private final String name;

  /** The plugin type. */
  private final String type;

  /** The instance UID. */
  private final String uid;

  protected LegacyDataSourceEntry(final Builder builder) {
    id = builder.id;
    name = builder.name;
    type = builder.type;
    uid = builder.uid;
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public String getUid() {
    return uid;
  }

  /** @return The modern reference for this entry. */
  public DataSourceRef toRef() {
    return new DataSourceRef(type, uid);
  }

  /**
   * Validates the entry.
   * @throws IllegalArgumentException if the type or UID is missing or the
   * entry can't be addressed.
   */
  public void validate() {
    if (Strings.isNullOrEmpty(type)) {
      throw new IllegalArgumentException("Missing or empty type.");
    }
    if (Strings.isNullOrEmpty(uid)) {
      throw new IllegalArgumentException("Missing or empty uid.");
    }
    if (id == 0 && Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Entry for uid [" + uid
          + "] needs an id or a name.");
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LegacyDataSourceEntry other = (LegacyDataSourceEntry) o;
    return id == other.id
        && Objects.equal(name, other.name)
        && Objects.equal(type, other.type)
        && Objects.equal(uid, other.uid);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, name, type, uid);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("id=")
        .append(id)
        .append(", name=")
        .append(name)
        .append(", type=")
        .append(type)
        .append(", uid=")
        .append(uid)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private long id;
    @JsonProperty
    private String name;
    @JsonProperty
    private String type;
    @JsonProperty
    private String uid;

    public Builder setId(final long id) {
      this.id = id;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setType(final String type) {
      this.type = type;
      return this;
    }

    public Builder setUid(final String uid) {
      this.uid = uid;
      return this;
    }

    public LegacyDataSourceEntry build() {
      return new LegacyDataSourceEntry(this);
    }
  }
}
