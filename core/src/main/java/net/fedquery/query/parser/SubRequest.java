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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;

import net.fedquery.data.QueryRequest;

/**
 * The slice of a request bound for a single target. The request keeps the
 * original query objects in their original relative order.
 *
 * @since 1.0
 */
@JsonPropertyOrder({ "pluginId", "uid", "request" })
public class SubRequest {
  private final ResolvedTarget target;
  private final QueryRequest request;

  /**
   * Default ctor.
   * @param target The non-null target.
   * @param request The non-null request for the target.
   */
  public SubRequest(final ResolvedTarget target, final QueryRequest request) {
    if (target == null) {
      throw new IllegalArgumentException("Target cannot be null.");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    this.target = target;
    this.request = request;
  }

  @JsonProperty("pluginId")
  public String getPluginId() {
    return target.getPluginId();
  }

  public String getUid() {
    return target.getUid();
  }

  public QueryRequest getRequest() {
    return request;
  }

  @JsonIgnore
  public ResolvedTarget getTarget() {
    return target;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SubRequest other = (SubRequest) o;
    return Objects.equal(target, other.target)
        && Objects.equal(request, other.request);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(target, request);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("target=[")
        .append(target)
        .append("], request=[")
        .append(request)
        .append("]")
        .toString();
  }
}
