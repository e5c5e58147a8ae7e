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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;

/**
 * The modern reference to a data source instance: the plugin type that
 * serves it and the instance UID.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = DataSourceRef.Builder.class)
public class DataSourceRef {
  /** The plugin type, e.g. "prometheus". May be null. */
  private final String type;

  /** The instance UID. May be null. */
  private final String uid;

  /**
   * Default ctor.
   * @param type The plugin type, may be null.
   * @param uid The instance UID, may be null.
   */
  public DataSourceRef(final String type, final String uid) {
    this.type = type;
    this.uid = uid;
  }

  protected DataSourceRef(final Builder builder) {
    this(builder.type, builder.uid);
  }

  /** @return The plugin type, may be null. */
  public String getType() {
    return type;
  }

  /** @return The instance UID, may be null. */
  public String getUid() {
    return uid;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DataSourceRef other = (DataSourceRef) o;
    return Objects.equal(type, other.type)
        && Objects.equal(uid, other.uid);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, uid);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type)
        .append(", uid=")
        .append(uid)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String type;
    @JsonProperty
    private String uid;

    public Builder setType(final String type) {
      this.type = type;
      return this;
    }

    public Builder setUid(final String uid) {
      this.uid = uid;
      return this;
    }

    public DataSourceRef build() {
      return new DataSourceRef(this);
    }
  }
}
