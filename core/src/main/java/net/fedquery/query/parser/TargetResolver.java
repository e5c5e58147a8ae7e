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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.fedquery.data.QuerySpec;
import net.fedquery.exceptions.MissingDataSourceException;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.QueryParseContext;

/**
 * Runs the ordered {@link TargetResolutionStrategy} chain over a query and
 * returns the first answer. A query no strategy accepts has no data source.
 *
 * @since 1.0
 */
public class TargetResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      TargetResolver.class);

  /** The ordered strategies. */
  private final List<TargetResolutionStrategy> strategies;

  /**
   * Default ctor.
   * @param strategies A non-null and non-empty ordered list of strategies.
   * @throws IllegalArgumentException if the list was null, empty or had a
   * null entry.
   */
  public TargetResolver(final List<TargetResolutionStrategy> strategies) {
    if (strategies == null || strategies.isEmpty()) {
      throw new IllegalArgumentException("Strategies cannot be null or "
          + "empty.");
    }
    if (strategies.contains(null)) {
      throw new IllegalArgumentException("Strategies cannot contain nulls.");
    }
    this.strategies = ImmutableList.copyOf(strategies);
  }

  /**
   * Builds the standard chain: built-in, expression, direct reference and
   * finally the legacy fields.
   * @param retriever The legacy retriever, may be null.
   * @param legacy_timeout The per lookup timeout in ms, 0 for none.
   * @return The ordered strategies.
   */
  public static List<TargetResolutionStrategy> defaultStrategies(
      final LegacyDataSourceRetriever retriever,
      final long legacy_timeout) {
    return ImmutableList.<TargetResolutionStrategy>of(
        new BuiltInDataSourceStrategy(),
        new ExpressionDataSourceStrategy(),
        new DirectReferenceStrategy(),
        new LegacyFieldsStrategy(retriever, legacy_timeout));
  }

  /**
   * Resolves the target of a query.
   * @param context The non-null parse context.
   * @param query The non-null query.
   * @return The non-null target.
   * @throws MissingDataSourceException if no strategy applied.
   * @throws net.fedquery.exceptions.QueryParseException if a strategy
   * applied but failed.
   */
  public ResolvedTarget resolve(final QueryParseContext context,
                                final QuerySpec query) {
    for (final TargetResolutionStrategy strategy : strategies) {
      final ResolvedTarget target = strategy.resolve(context, query);
      if (target != null) {
        if (LOG.isTraceEnabled()) {
          LOG.trace("Strategy " + strategy.id() + " resolved query \""
              + query.getRefId() + "\" to " + target);
        }
        return target;
      }
    }
    throw new MissingDataSourceException(query.getRefId());
  }

  /** @return The ordered strategies. */
  public List<TargetResolutionStrategy> strategies() {
    return strategies;
  }
}
