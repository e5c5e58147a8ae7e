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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.fedquery.common.Const;

/**
 * A pair of opaque time expressions. Values may be absolute timestamps or
 * relative expressions like {@code now-1h}; the parser only ever checks them
 * for presence.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = TimeRange.Builder.class)
public class TimeRange {

  /** The range applied when neither the query nor the request has one. */
  public static final TimeRange ZERO = new TimeRange(Const.ZERO_TIME,
      Const.ZERO_TIME);

  /** User given start, could be relative or absolute */
  private final String from;

  /** User given end, could be relative or absolute */
  private final String to;

  /**
   * Default ctor.
   * @param from The start, may be null or empty.
   * @param to The end, may be null or empty.
   */
  public TimeRange(final String from, final String to) {
    this.from = from;
    this.to = to;
  }

  protected TimeRange(final Builder builder) {
    this(builder.from, builder.to);
  }

  /** @return The start expression, may be null. */
  public String getFrom() {
    return from;
  }

  /** @return The end expression, may be null. */
  public String getTo() {
    return to;
  }

  /** @return True if both ends are non-null and non-empty. */
  @JsonIgnore
  public boolean isComplete() {
    return !Strings.isNullOrEmpty(from) && !Strings.isNullOrEmpty(to);
  }

  /** @return True if both ends are null or empty. */
  @JsonIgnore
  public boolean isEmpty() {
    return Strings.isNullOrEmpty(from) && Strings.isNullOrEmpty(to);
  }

  /** @return True if exactly one end is set. */
  @JsonIgnore
  public boolean isPartial() {
    return !isComplete() && !isEmpty();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return Objects.equal(from, other.from)
        && Objects.equal(to, other.to);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(from, to);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("from=")
        .append(from)
        .append(", to=")
        .append(to)
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
    private String from;
    @JsonProperty
    private String to;

    public Builder setFrom(final String from) {
      this.from = from;
      return this;
    }

    public Builder setTo(final String to) {
      this.to = to;
      return this;
    }

    public TimeRange build() {
      return new TimeRange(this);
    }
  }
}
