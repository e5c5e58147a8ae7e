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

import java.util.List;
import java.util.Set;

import com.google.common.collect.Sets;

import net.fedquery.data.QueryRequest;
import net.fedquery.data.QuerySpec;
import net.fedquery.exceptions.DuplicateRefIdException;

/**
 * Structural checks run before anything is resolved. Reference IDs must be
 * unique within a request, the empty ID included.
 *
 * @since 1.0
 */
public class RequestValidator {

  /**
   * @param request The request to check.
   * @throws IllegalArgumentException if the request or a query was null.
   * @throws DuplicateRefIdException on the first repeated reference ID.
   */
  public void validate(final QueryRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    final List<QuerySpec> queries = request.getQueries();
    final Set<String> seen = Sets.newHashSetWithExpectedSize(queries.size());
    for (int i = 0; i < queries.size(); i++) {
      final QuerySpec query = queries.get(i);
      if (query == null) {
        throw new IllegalArgumentException("Null query at index " + i);
      }
      if (!seen.add(query.getRefId())) {
        throw new DuplicateRefIdException(query.getRefId(), i);
      }
    }
  }
}
