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
import net.fedquery.exceptions.InvalidTimeRangeException;

/**
 * Picks the effective time range of a query: a complete per-query range,
 * else a complete request range, else {@link TimeRange#ZERO}. A range with
 * exactly one end set is rejected wherever it would be used.
 *
 * @since 1.0
 */
public class TimeRangeResolver {

  /**
   * @param global The request range, may be null.
   * @param query The non-null query.
   * @return The effective range, never null.
   * @throws InvalidTimeRangeException if the range that would apply was
   * partial.
   */
  public TimeRange resolve(final TimeRange global, final QuerySpec query) {
    final TimeRange local = query.getTimeRange();
    if (local != null) {
      if (local.isComplete()) {
        return local;
      }
      if (local.isPartial()) {
        throw InvalidTimeRangeException.forQuery(query.getRefId(), local);
      }
    }
    if (global != null) {
      if (global.isComplete()) {
        return global;
      }
      if (global.isPartial()) {
        throw InvalidTimeRangeException.forRequest(query.getRefId(), global);
      }
    }
    return TimeRange.ZERO;
  }
}
