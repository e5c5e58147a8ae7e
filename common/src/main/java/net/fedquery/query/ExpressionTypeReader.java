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
package net.fedquery.query;

import net.fedquery.data.QuerySpec;

/**
 * Reads the expression sub-type of a query that resolved to the expression
 * pseudo-target. Implementations own any feature flags that gate which
 * sub-types are accepted and must be safe for concurrent use.
 *
 * @since 1.0
 */
public interface ExpressionTypeReader {

  /**
   * Classifies the expression query.
   * @param context The non-null context of the parse call.
   * @param query The non-null expression query.
   * @return The non-null expression type.
   * @throws RuntimeException (typically an {@link IllegalArgumentException})
   * if the query is not a recognized or permitted expression.
   */
  public ExpressionType readExpressionType(final QueryParseContext context,
                                           final QuerySpec query);
}
