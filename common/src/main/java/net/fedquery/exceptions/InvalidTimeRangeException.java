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
package net.fedquery.exceptions;

import net.fedquery.common.Const;
import net.fedquery.data.TimeRange;

/**
 * Thrown when a time range has exactly one of its endpoints set.
 *
 * @since 1.0
 */
public class InvalidTimeRangeException extends QueryParseException {
  private static final long serialVersionUID = 5520960845511312904L;

  private InvalidTimeRangeException(final String msg, final String ref_id) {
    super(msg, Const.BAD_REQUEST, ref_id);
  }

  /**
   * @param ref_id The reference ID of the query.
   * @param range The query's own partial range.
   * @return An exception for a partial per-query range.
   */
  public static InvalidTimeRangeException forQuery(final String ref_id,
                                                   final TimeRange range) {
    return new InvalidTimeRangeException("Partial time range for query "
        + quote(ref_id) + " [" + range + "]", ref_id);
  }

  /**
   * @param ref_id The reference ID of the query inheriting the range.
   * @param range The request's partial range.
   * @return An exception for a partial request range.
   */
  public static InvalidTimeRangeException forRequest(final String ref_id,
                                                     final TimeRange range) {
    return new InvalidTimeRangeException("Partial request time range ["
        + range + "] inherited by query " + quote(ref_id), ref_id);
  }
}
