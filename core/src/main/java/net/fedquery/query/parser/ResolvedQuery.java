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

import net.fedquery.data.QuerySpec;
import net.fedquery.data.TimeRange;

/**
 * A query annotated with its position in the request, its target and its
 * effective time range.
 *
 * @since 1.0
 */
public class ResolvedQuery {
  private final int index;
  private final QuerySpec query;
  private final ResolvedTarget target;
  private final TimeRange time_range;

  /**
   * Default ctor.
   * @param index The position of the query in the request.
   * @param query The non-null query.
   * @param target The non-null target.
   * @param time_range The non-null effective range.
   */
  public ResolvedQuery(final int index,
                       final QuerySpec query,
                       final ResolvedTarget target,
                       final TimeRange time_range) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    if (target == null) {
      throw new IllegalArgumentException("Target cannot be null.");
    }
    if (time_range == null) {
      throw new IllegalArgumentException("Time range cannot be null.");
    }
    this.index = index;
    this.query = query;
    this.target = target;
    this.time_range = time_range;
  }

  public int index() {
    return index;
  }

  public QuerySpec query() {
    return query;
  }

  public String refId() {
    return query.getRefId();
  }

  public ResolvedTarget target() {
    return target;
  }

  public TimeRange timeRange() {
    return time_range;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("index=")
        .append(index)
        .append(", refId=")
        .append(query.getRefId())
        .append(", target=[")
        .append(target)
        .append("], timeRange=[")
        .append(time_range)
        .append("]")
        .toString();
  }
}
