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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.fedquery.data.QueryRequest;
import net.fedquery.data.QuerySpec;
import net.fedquery.data.TimeRange;
import net.fedquery.exceptions.QueryParseException;
import net.fedquery.query.ExpressionType;
import net.fedquery.query.ExpressionTypeReader;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.QueryParseContext;
import net.fedquery.stats.Span;

/**
 * Splits a client request into one sub-request per downstream target.
 * <p>
 * The stages run in order over the whole request: structural validation,
 * effective time ranges, target resolution, expression classification and
 * finally partitioning. The first failure aborts the parse and nothing
 * partial is returned. Cancellation and the context deadline are checked
 * before each query is resolved and before each expression is classified.
 * <p>
 * The parser holds no per request state and may be shared between threads.
 *
 * @since 1.0
 */
public class QueryParser {
  private static final Logger LOG = LoggerFactory.getLogger(QueryParser.class);

  private final RequestValidator validator;
  private final TimeRangeResolver time_range_resolver;
  private final TargetResolver target_resolver;
  private final ExpressionClassifier classifier;
  private final RequestPartitioner partitioner;

  /**
   * Ctor with the standard stages and no legacy lookup timeout.
   * @param reader A non-null expression type reader.
   * @param retriever The legacy retriever, may be null.
   */
  public QueryParser(final ExpressionTypeReader reader,
                     final LegacyDataSourceRetriever retriever) {
    this(reader, retriever, 0);
  }

  /**
   * Ctor with the standard stages.
   * @param reader A non-null expression type reader.
   * @param retriever The legacy retriever, may be null.
   * @param legacy_timeout A per lookup timeout in ms, 0 for none.
   */
  public QueryParser(final ExpressionTypeReader reader,
                     final LegacyDataSourceRetriever retriever,
                     final long legacy_timeout) {
    this(new RequestValidator(),
         new TimeRangeResolver(),
         new TargetResolver(
             TargetResolver.defaultStrategies(retriever, legacy_timeout)),
         new ExpressionClassifier(reader),
         new RequestPartitioner());
  }

  /**
   * Ctor taking each stage.
   * @param validator A non-null validator.
   * @param time_range_resolver A non-null time range resolver.
   * @param target_resolver A non-null target resolver.
   * @param classifier A non-null expression classifier.
   * @param partitioner A non-null partitioner.
   */
  public QueryParser(final RequestValidator validator,
                     final TimeRangeResolver time_range_resolver,
                     final TargetResolver target_resolver,
                     final ExpressionClassifier classifier,
                     final RequestPartitioner partitioner) {
    if (validator == null) {
      throw new IllegalArgumentException("Validator cannot be null.");
    }
    if (time_range_resolver == null) {
      throw new IllegalArgumentException("Time range resolver cannot be null.");
    }
    if (target_resolver == null) {
      throw new IllegalArgumentException("Target resolver cannot be null.");
    }
    if (classifier == null) {
      throw new IllegalArgumentException("Classifier cannot be null.");
    }
    if (partitioner == null) {
      throw new IllegalArgumentException("Partitioner cannot be null.");
    }
    this.validator = validator;
    this.time_range_resolver = time_range_resolver;
    this.target_resolver = target_resolver;
    this.classifier = classifier;
    this.partitioner = partitioner;
  }

  /**
   * Parses the request.
   * @param context The non-null parse context.
   * @param request The non-null request.
   * @return The parsed request, never null.
   * @throws IllegalArgumentException if the context, request or a query was
   * null.
   * @throws QueryParseException if the request could not be parsed.
   */
  public ParsedRequestInfo parseRequest(final QueryParseContext context,
                                        final QueryRequest request) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    final Span span = context.span() != null ?
        context.span().newChild(getClass().getSimpleName() + ".parseRequest")
          .withTag("queries", request == null ? 0 :
            request.getQueries().size())
          .start()
        : null;
    try {
      final ParsedRequestInfo info = parse(context.withSpan(span), span,
          request);
      if (span != null) {
        span.setSuccessTags()
            .setTag("subRequests", info.getRequests().size())
            .finish();
      }
      return info;
    } catch (RuntimeException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Failed to parse request", e);
      }
      if (span != null) {
        span.setErrorTags(e).finish();
      }
      throw e;
    }
  }

  private ParsedRequestInfo parse(final QueryParseContext context,
                                  final Span span,
                                  final QueryRequest request) {
    validator.validate(request);
    final List<QuerySpec> queries = request.getQueries();
    if (queries.isEmpty()) {
      return ParsedRequestInfo.EMPTY;
    }

    final TimeRange global = request.getTimeRange();
    final List<TimeRange> ranges = Lists.newArrayListWithCapacity(
        queries.size());
    for (final QuerySpec query : queries) {
      ranges.add(time_range_resolver.resolve(global, query));
    }

    final List<ResolvedQuery> resolved = Lists.newArrayListWithCapacity(
        queries.size());
    for (int i = 0; i < queries.size(); i++) {
      final QuerySpec query = queries.get(i);
      context.checkActive(query.getRefId());
      resolved.add(new ResolvedQuery(i, query,
          resolveTarget(context, span, i, query), ranges.get(i)));
    }

    final Map<String, ExpressionType> expression_types =
        classifier.classify(context, resolved);
    final List<SubRequest> requests = partitioner.partition(resolved);
    final ParsedRequestInfo info = new ParsedRequestInfo(requests,
        ExpressionClassifier.sqlInputs(expression_types),
        partitioner.refIdTypes(resolved),
        expression_types);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Parsed " + queries.size() + " queries into "
          + requests.size() + " sub-requests with "
          + info.getSqlInputs().size() + " SQL inputs");
    }
    return info;
  }

  private ResolvedTarget resolveTarget(final QueryParseContext context,
                                       final Span span,
                                       final int index,
                                       final QuerySpec query) {
    final Span child = span != null ?
        span.newChild(getClass().getSimpleName() + ".resolveTarget")
          .withTag("index", index)
          .start()
        : null;
    if (child != null && !query.getRefId().isEmpty()) {
      child.setTag("refId", query.getRefId());
    }
    final ResolvedTarget target;
    try {
      target = target_resolver.resolve(context.withSpan(child), query);
    } catch (RuntimeException e) {
      if (child != null) {
        child.setErrorTags(e).finish();
      }
      throw e;
    }
    if (child != null) {
      child.setSuccessTags()
           .setTag("pluginId", target.getPluginId())
           .setTag("uid", target.getUid())
           .finish();
    }
    return target;
  }
}
