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
package net.fedquery.query.parser;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import net.fedquery.query.ExpressionType;

/**
 * The result of parsing a request: one {@link SubRequest} per distinct
 * target in first appearance order, the reference IDs of the SQL
 * expressions, and per query routing details.
 * <p>
 * SQL inputs serialize as an object keyed by reference ID with empty object
 * values.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "requests", "sqlInputs", "refIdTypes",
    "expressionTypes" })
public class ParsedRequestInfo {

  /** The result for a request without queries. */
  public static final ParsedRequestInfo EMPTY = new ParsedRequestInfo(
      Collections.<SubRequest>emptyList(),
      Collections.<String>emptySet(),
      Collections.<String, String>emptyMap(),
      Collections.<String, ExpressionType>emptyMap());

  private final List<SubRequest> requests;
  private final Set<String> sql_inputs;
  private final Map<String, String> ref_id_types;
  private final Map<String, ExpressionType> expression_types;

  /**
   * Default ctor.
   * @param requests The non-null sub-requests.
   * @param sql_inputs The non-null SQL expression reference IDs.
   * @param ref_id_types The non-null map of reference ID to plugin ID.
   * @param expression_types The non-null map of expression reference ID to
   * type.
   */
  public ParsedRequestInfo(final List<SubRequest> requests,
                           final Set<String> sql_inputs,
                           final Map<String, String> ref_id_types,
                           final Map<String, ExpressionType> expression_types) {
    this.requests = ImmutableList.copyOf(requests);
    this.sql_inputs = ImmutableSet.copyOf(sql_inputs);
    this.ref_id_types = ImmutableMap.copyOf(ref_id_types);
    this.expression_types = ImmutableMap.copyOf(expression_types);
  }

  /** @return The sub-requests in first appearance order of their target. */
  public List<SubRequest> getRequests() {
    return requests;
  }

  /** @return The reference IDs of the SQL expressions. */
  @JsonIgnore
  public Set<String> getSqlInputs() {
    return sql_inputs;
  }

  /**
   * @param ref_id A reference ID.
   * @return True if the ID belongs to a SQL expression.
   */
  public boolean isSqlInput(final String ref_id) {
    return sql_inputs.contains(ref_id);
  }

  /** @return The plugin ID each query was routed to. */
  @JsonProperty("refIdTypes")
  @JsonInclude(Include.NON_EMPTY)
  public Map<String, String> getRefIdTypes() {
    return ref_id_types;
  }

  /** @return The type of each expression query. */
  @JsonProperty("expressionTypes")
  @JsonInclude(Include.NON_EMPTY)
  public Map<String, ExpressionType> getExpressionTypes() {
    return expression_types;
  }

  @JsonProperty("sqlInputs")
  @JsonInclude(Include.NON_EMPTY)
  Map<String, Map<String, Object>> serdesSqlInputs() {
    final Map<String, Map<String, Object>> map = Maps.newLinkedHashMap();
    for (final String ref_id : sql_inputs) {
      map.put(ref_id, Collections.<String, Object>emptyMap());
    }
    return map;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ParsedRequestInfo other = (ParsedRequestInfo) o;
    return Objects.equal(requests, other.requests)
        && Objects.equal(sql_inputs, other.sql_inputs)
        && Objects.equal(ref_id_types, other.ref_id_types)
        && Objects.equal(expression_types, other.expression_types);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(requests, sql_inputs, ref_id_types,
        expression_types);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("requests=")
        .append(requests)
        .append(", sqlInputs=")
        .append(sql_inputs)
        .append(", refIdTypes=")
        .append(ref_id_types)
        .append(", expressionTypes=")
        .append(expression_types)
        .toString();
  }
}
