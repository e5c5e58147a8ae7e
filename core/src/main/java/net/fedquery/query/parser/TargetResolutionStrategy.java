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
import net.fedquery.query.QueryParseContext;

/**
 * One step in the chain that decides where a query is sent. Strategies are
 * consulted in order and the first non-null answer wins.
 *
 * @since 1.0
 */
public interface TargetResolutionStrategy {

  /** @return A short, non-null ID used in logs and span tags. */
  public String id();

  /**
   * Attempts to resolve the target for the query.
   * @param context The non-null parse context.
   * @param query The non-null query.
   * @return The target or null if this strategy does not apply.
   * @throws net.fedquery.exceptions.QueryParseException if the strategy
   * applies but resolution failed.
   */
  public ResolvedTarget resolve(final QueryParseContext context,
                                final QuerySpec query);
}
