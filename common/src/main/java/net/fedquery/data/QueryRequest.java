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
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.collect.Lists;

/**
 * A client request bundling one or more queries with an optional global
 * time range. The same shape is used for the per-target requests the parser
 * emits.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "from", "to", "queries" })
@JsonDeserialize(builder = QueryRequest.Builder.class)
public class QueryRequest {
  /** The global start, may be null. */
  private final String from;

  /** The global end, may be null. */
  private final String to;

  /** The ordered queries. */
  private final List<QuerySpec> queries;

  protected QueryRequest(final Builder builder) {
    from = builder.from;
    to = builder.to;
    queries = builder.queries == null ?
        Collections.<QuerySpec>emptyList() :
          Collections.unmodifiableList(Lists.newArrayList(builder.queries));
  }

  /** @return The global start, may be null. */
  public String getFrom() {
    return from;
  }

  /** @return The global end, may be null. */
  public String getTo() {
    return to;
  }

  /** @return The global range as a time range object. Never null. */
  @JsonIgnore
  public TimeRange getTimeRange() {
    return new TimeRange(from, to);
  }

  /** @return The ordered, unmodifiable, list of queries. Never null. */
  public List<QuerySpec> getQueries() {
    return queries;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QueryRequest other = (QueryRequest) o;
    return Objects.equal(from, other.from)
        && Objects.equal(to, other.to)
        && Objects.equal(queries, other.queries);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(from, to, queries);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("from=")
        .append(from)
        .append(", to=")
        .append(to)
        .append(", queries=")
        .append(queries)
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
    @JsonProperty
    private List<QuerySpec> queries;

    public Builder setFrom(final String from) {
      this.from = from;
      return this;
    }

    public Builder setTo(final String to) {
      this.to = to;
      return this;
    }

    @JsonIgnore
    public Builder setTimeRange(final TimeRange range) {
      if (range == null) {
        from = null;
        to = null;
      } else {
        from = range.getFrom();
        to = range.getTo();
      }
      return this;
    }

    public Builder setQueries(final List<QuerySpec> queries) {
      this.queries = queries;
      return this;
    }

    @JsonIgnore
    public Builder addQuery(final QuerySpec query) {
      if (queries == null) {
        queries = Lists.newArrayList();
      }
      queries.add(query);
      return this;
    }

    @JsonIgnore
    public Builder addQuery(final QuerySpec.Builder query) {
      return addQuery(query.build());
    }

    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }
}
