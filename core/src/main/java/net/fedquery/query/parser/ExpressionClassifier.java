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
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import net.fedquery.exceptions.InvalidExpressionException;
import net.fedquery.exceptions.QueryParseException;
import net.fedquery.query.ExpressionType;
import net.fedquery.query.ExpressionTypeReader;
import net.fedquery.query.QueryParseContext;
import net.fedquery.stats.Span;

/**
 * Reads the type of every query routed to the expression target. The result
 * maps reference IDs to types in request order; SQL expressions among them
 * are the request's SQL inputs.
 *
 * @since 1.0
 */
public class ExpressionClassifier {

  /** The reader that understands expression models. */
  private final ExpressionTypeReader reader;

  /**
   * Default ctor.
   * @param reader A non-null reader.
   */
  public ExpressionClassifier(final ExpressionTypeReader reader) {
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    this.reader = reader;
  }

  /**
   * Classifies the expression queries. Non-expression queries are skipped.
   * @param context The non-null parse context.
   * @param queries The non-null resolved queries in request order.
   * @return An ordered map of reference ID to type, possibly empty.
   * @throws InvalidExpressionException if a type could not be read.
   * @throws net.fedquery.exceptions.QueryParseCanceled if the parse was
   * canceled or the deadline passed.
   */
  public Map<String, ExpressionType> classify(
      final QueryParseContext context,
      final List<ResolvedQuery> queries) {
    final ImmutableMap.Builder<String, ExpressionType> types =
        ImmutableMap.builder();
    for (final ResolvedQuery query : queries) {
      if (!query.target().isExpression()) {
        continue;
      }
      context.checkActive(query.refId());
      types.put(query.refId(), classify(context, query));
    }
    return types.build();
  }

  /**
   * @param types The classified expressions.
   * @return The reference IDs of the SQL expressions in order.
   */
  public static Set<String> sqlInputs(
      final Map<String, ExpressionType> types) {
    final ImmutableSet.Builder<String> inputs = ImmutableSet.builder();
    for (final Entry<String, ExpressionType> entry : types.entrySet()) {
      if (entry.getValue() == ExpressionType.SQL) {
        inputs.add(entry.getKey());
      }
    }
    return inputs.build();
  }

  private ExpressionType classify(final QueryParseContext context,
                                  final ResolvedQuery query) {
    final Span child = context.span() != null ?
        context.span().newChild(getClass().getSimpleName() + ".classify")
          .withTag("index", query.index())
          .start()
        : null;
    if (child != null && !query.refId().isEmpty()) {
      child.setTag("refId", query.refId());
    }
    final ExpressionType type;
    try {
      type = reader.readExpressionType(context.withSpan(child), query.query());
    } catch (QueryParseException e) {
      if (child != null) {
        child.setErrorTags(e).finish();
      }
      throw e;
    } catch (RuntimeException e) {
      if (child != null) {
        child.setErrorTags(e).finish();
      }
      throw new InvalidExpressionException(query.refId(), e);
    }
    if (type == null) {
      final InvalidExpressionException ex = new InvalidExpressionException(
          query.refId(), new IllegalStateException("No expression type."));
      if (child != null) {
        child.setErrorTags(ex).finish();
      }
      throw ex;
    }
    if (child != null) {
      child.setSuccessTags()
           .setTag("type", type.getName())
           .finish();
    }
    return type;
  }
}
