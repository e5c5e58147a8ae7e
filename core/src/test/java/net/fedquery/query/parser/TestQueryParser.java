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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.fedquery.data.QueryRequest;
import net.fedquery.data.QuerySpec;
import net.fedquery.exceptions.DuplicateRefIdException;
import net.fedquery.exceptions.InvalidExpressionException;
import net.fedquery.exceptions.InvalidTimeRangeException;
import net.fedquery.exceptions.LegacyResolutionException;
import net.fedquery.exceptions.MissingDataSourceException;
import net.fedquery.exceptions.MissingLegacyParameterException;
import net.fedquery.exceptions.QueryParseCanceled;
import net.fedquery.query.ExpressionType;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.QueryParseContext;
import net.fedquery.query.expression.DefaultExpressionTypeReader;
import net.fedquery.stats.MockTrace;
import net.fedquery.stats.MockTrace.MockSpan;

public class TestQueryParser {
  private MockLegacyRetriever retriever;
  private QueryParser parser;
  private QueryParseContext context;

  @Before
  public void before() throws Exception {
    retriever = new MockLegacyRetriever();
    parser = new QueryParser(new DefaultExpressionTypeReader(false),
        retriever);
    context = QueryParseContext.background();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new QueryParser(null, retriever);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new QueryParser(null, new TimeRangeResolver(),
          new TargetResolver(TargetResolver.defaultStrategies(null, 0)),
          new ExpressionClassifier(new DefaultExpressionTypeReader(false)),
          new RequestPartitioner());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // no retriever is allowed
    new QueryParser(new DefaultExpressionTypeReader(false), null);
  }

  @Test
  public void nullArguments() throws Exception {
    try {
      parser.parseRequest(null, QueryRequest.newBuilder().build());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      parser.parseRequest(context, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void emptyRequest() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder().setFrom("now-1h").setTo("now").build());
    assertSame(ParsedRequestInfo.EMPTY, info);
    assertTrue(info.getRequests().isEmpty());
    assertTrue(info.getSqlInputs().isEmpty());
  }

  @Test
  public void missingDataSource() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder().setRefId("A"))
          .build());
      fail("Expected MissingDataSourceException");
    } catch (MissingDataSourceException e) {
      assertEquals("A", e.getRefId());
    }
  }

  @Test
  public void zeroTimeRangeWhenMissing() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "x", "abc"))
          .build());
    assertEquals(1, info.getRequests().size());
    assertEquals("0", info.getRequests().get(0).getRequest().getFrom());
    assertEquals("0", info.getRequests().get(0).getRequest().getTo());
  }

  @Test
  public void duplicateRefIds() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(query("A", "x", "abc"))
          .addQuery(query("A", "x", "abc"))
          .build());
      fail("Expected DuplicateRefIdException");
    } catch (DuplicateRefIdException e) {
      assertEquals(1, e.getIndex());
    }

    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(query("", "x", "abc"))
          .addQuery(query("", "x", "abc"))
          .build());
      fail("Expected DuplicateRefIdException");
    } catch (DuplicateRefIdException e) {
      assertEquals("", e.getRefId());
    }
  }

  @Test
  public void emptyRefIdAllowed() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("", "x", "abc"))
          .addQuery(query("B", "x", "abc"))
          .build());
    assertEquals(1, info.getRequests().size());
    assertEquals(2, info.getRequests().get(0).getRequest().getQueries()
        .size());
  }

  @Test
  public void queryTimeRangeApplied() throws Exception {
    ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "x", "abc").setTimeRange("now-1d", "now"))
          .build());
    assertEquals("now-1d", info.getRequests().get(0).getRequest().getFrom());
    assertEquals("now", info.getRequests().get(0).getRequest().getTo());

    // wins over the global range
    info = parser.parseRequest(context, QueryRequest.newBuilder()
          .setFrom("now-1h")
          .setTo("now")
          .addQuery(query("A", "x", "abc").setTimeRange("now-1d", "now"))
          .build());
    assertEquals("now-1d", info.getRequests().get(0).getRequest().getFrom());
    assertEquals("now", info.getRequests().get(0).getRequest().getTo());
  }

  @Test
  public void globalTimeRangeApplied() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .setFrom("now-1h")
          .setTo("now")
          .addQuery(query("A", "x", "abc"))
          .addQuery(query("B", "y", "def"))
          .build());
    assertEquals(2, info.getRequests().size());
    for (final SubRequest request : info.getRequests()) {
      assertEquals("now-1h", request.getRequest().getFrom());
      assertEquals("now", request.getRequest().getTo());
    }
  }

  @Test
  public void partialTimeRange() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .setFrom("now-1h")
          .addQuery(query("A", "x", "abc"))
          .build());
      fail("Expected InvalidTimeRangeException");
    } catch (InvalidTimeRangeException e) {
      assertEquals("A", e.getRefId());
    }
  }

  @Test
  public void stagesRunInOrder() throws Exception {
    // the range of B fails before the target of A is looked at
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder().setRefId("A"))
          .addQuery(query("B", "x", "abc").setTimeRange(null, "now"))
          .build());
      fail("Expected InvalidTimeRangeException");
    } catch (InvalidTimeRangeException e) {
      assertEquals("B", e.getRefId());
    }
  }

  @Test
  public void partitions() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "prometheus", "prom-1"))
          .addQuery(query("B", "prometheus", "prom-2"))
          .addQuery(query("C", "prometheus", "prom-1"))
          .addQuery(query("D", "__expr__", "__expr__")
              .addProperty("type", "math")
              .addProperty("expression", "$A + $B"))
          .build());
    assertEquals(3, info.getRequests().size());
    assertEquals(new ResolvedTarget("prometheus", "prom-1"),
        info.getRequests().get(0).getTarget());
    assertEquals(Lists.newArrayList("A", "C"),
        refIds(info.getRequests().get(0)));
    assertEquals(new ResolvedTarget("prometheus", "prom-2"),
        info.getRequests().get(1).getTarget());
    assertEquals(ResolvedTarget.EXPRESSION,
        info.getRequests().get(2).getTarget());
    assertTrue(info.getSqlInputs().isEmpty());
    assertEquals(ExpressionType.MATH, info.getExpressionTypes().get("D"));
    assertEquals("prometheus", info.getRefIdTypes().get("A"));
    assertEquals("__expr__", info.getRefIdTypes().get("D"));
  }

  @Test
  public void sqlInputs() throws Exception {
    parser = new QueryParser(new DefaultExpressionTypeReader(true), null);
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "prometheus", "local-prom"))
          .addQuery(query("B", "__expr__", "__expr__")
              .addProperty("type", "sql")
              .addProperty("expression", "Select time, value + 10 from A"))
          .build());
    assertEquals(ImmutableSet.of("B"), info.getSqlInputs());
    assertTrue(info.isSqlInput("B"));
    assertTrue(!info.isSqlInput("A"));
  }

  @Test
  public void sqlWithCte() throws Exception {
    parser = new QueryParser(new DefaultExpressionTypeReader(true), null);
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "prometheus", "local-prom"))
          .addQuery(query("B", "__expr__", "__expr__")
              .addProperty("type", "sql")
              .addProperty("expression", "WITH CTE AS (\n"
                  + "  SELECT\n    Month\n  FROM A\n)\n\nSELECT * FROM CTE"))
          .build());
    assertEquals(ImmutableSet.of("B"), info.getSqlInputs());
  }

  @Test
  public void sqlDisabled() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(query("A", "prometheus", "local-prom"))
          .addQuery(query("B", "__expr__", "__expr__")
              .addProperty("type", "sql")
              .addProperty("expression", "SELECT 1"))
          .build());
      fail("Expected InvalidExpressionException");
    } catch (InvalidExpressionException e) {
      assertEquals("B", e.getRefId());
    }
  }

  @Test
  public void builtinWithoutType() throws Exception {
    final LegacyDataSourceRetriever no_legacy =
        mock(LegacyDataSourceRetriever.class);
    parser = new QueryParser(new DefaultExpressionTypeReader(false),
        no_legacy);
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSource(null, "builtin"))
          .build());
    assertEquals(1, info.getRequests().size());
    assertEquals("builtin", info.getRequests().get(0).getPluginId());
    assertEquals("builtin", info.getRequests().get(0).getUid());
    verify(no_legacy, never()).getDataSourceFromDeprecatedFields(
        any(QueryParseContext.class), any(), anyLong());
  }

  @Test
  public void builtinWithOtherType() throws Exception {
    final LegacyDataSourceRetriever no_legacy =
        mock(LegacyDataSourceRetriever.class);
    parser = new QueryParser(new DefaultExpressionTypeReader(false),
        no_legacy);
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(query("A", "datasource", "builtin"))
          .build());
    assertEquals(1, info.getRequests().size());
    assertEquals("builtin", info.getRequests().get(0).getPluginId());
    assertEquals("builtin", info.getRequests().get(0).getUid());
    verify(no_legacy, never()).getDataSourceFromDeprecatedFields(
        any(QueryParseContext.class), any(), anyLong());
  }

  @Test
  public void modernReferenceWithLegacyExpressionId() throws Exception {
    parser = new QueryParser(new DefaultExpressionTypeReader(true), retriever);
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSource("prometheus", "prom1")
              .setDataSourceId(-100))
          .build());
    assertEquals(1, info.getRequests().size());
    assertEquals("prometheus", info.getRequests().get(0).getPluginId());
    assertEquals("prom1", info.getRequests().get(0).getUid());
    assertTrue(info.getExpressionTypes().isEmpty());
    assertEquals(0, retriever.calls.get());
  }

  @Test
  public void legacyFields() throws Exception {
    final ParsedRequestInfo info = parser.parseRequest(context,
        QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceId(100))
          .addQuery(QuerySpec.newBuilder()
              .setRefId("B")
              .setDataSourceName("my-influx"))
          .build());
    assertEquals(2, info.getRequests().size());
    assertEquals(new ResolvedTarget("plugin-aaaa", "AAA"),
        info.getRequests().get(0).getTarget());
    assertEquals(new ResolvedTarget("plugin-bbb", "my-influx"),
        info.getRequests().get(1).getTarget());
    assertEquals(2, retriever.calls.get());
  }

  @Test
  public void legacyMissingParameter() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceId(7))
          .build());
      fail("Expected LegacyResolutionException");
    } catch (LegacyResolutionException e) {
      assertEquals("A", e.getRefId());
      assertTrue(e.getCause() instanceof MissingLegacyParameterException);
    }
  }

  @Test
  public void failFast() throws Exception {
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder().setRefId("A"))
          .addQuery(QuerySpec.newBuilder()
              .setRefId("B")
              .setDataSourceId(100))
          .build());
      fail("Expected MissingDataSourceException");
    } catch (MissingDataSourceException e) {
      assertEquals("A", e.getRefId());
    }
    assertEquals(0, retriever.calls.get());
  }

  @Test
  public void idempotent() throws Exception {
    final QueryRequest request = QueryRequest.newBuilder()
        .setFrom("now-1h")
        .setTo("now")
        .addQuery(query("A", "prometheus", "prom-1"))
        .addQuery(QuerySpec.newBuilder()
            .setRefId("B")
            .setDataSourceName("my-influx"))
        .addQuery(query("C", "__expr__", "__expr__")
            .addProperty("type", "reduce"))
        .build();
    final QueryRequest copy = QueryRequest.newBuilder()
        .setFrom(request.getFrom())
        .setTo(request.getTo())
        .setQueries(request.getQueries())
        .build();
    final ParsedRequestInfo first = parser.parseRequest(context, request);
    final ParsedRequestInfo second = parser.parseRequest(context, request);
    assertEquals(first, second);
    assertEquals(copy, request);
  }

  @Test
  public void canceled() throws Exception {
    context.cancel();
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceId(100))
          .build());
      fail("Expected QueryParseCanceled");
    } catch (QueryParseCanceled e) {
      assertEquals(499, e.getStatusCode());
      assertEquals("A", e.getRefId());
    }
    assertEquals(0, retriever.calls.get());
  }

  @Test
  public void deadlineExceeded() throws Exception {
    context = QueryParseContext.newBuilder()
        .setDeadline(System.currentTimeMillis() - 1000)
        .build();
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(query("A", "x", "abc"))
          .build());
      fail("Expected QueryParseCanceled");
    } catch (QueryParseCanceled e) {
      assertEquals(408, e.getStatusCode());
    }
  }

  @Test
  public void spans() throws Exception {
    final MockTrace trace = new MockTrace();
    context = QueryParseContext.newBuilder()
        .setSpan(trace.newSpan("root").start())
        .build();
    parser.parseRequest(context, QueryRequest.newBuilder()
        .addQuery(query("A", "prometheus", "prom-1"))
        .addQuery(QuerySpec.newBuilder()
            .setRefId("B")
            .setDataSourceId(100))
        .build());

    final MockSpan parse = trace.span("QueryParser.parseRequest");
    assertNotNull(parse);
    assertSame(trace.first_span, parse.parent);
    assertEquals("OK", parse.tags.get("status"));
    assertEquals(2, parse.tags.get("queries"));
    assertEquals(2, parse.tags.get("subRequests"));

    assertEquals(2, trace.count("QueryParser.resolveTarget"));
    final MockSpan resolve = trace.span("QueryParser.resolveTarget");
    assertSame(parse, resolve.parent);
    assertEquals("A", resolve.tags.get("refId"));
    assertEquals("prometheus", resolve.tags.get("pluginId"));

    final MockSpan lookup = trace.span("LegacyFieldsStrategy.lookup");
    assertNotNull(lookup);
    assertEquals("B", ((MockSpan) lookup.parent).tags.get("refId"));
  }

  @Test
  public void spansOnError() throws Exception {
    final MockTrace trace = new MockTrace();
    context = QueryParseContext.newBuilder()
        .setSpan(trace.newSpan("root").start())
        .build();
    try {
      parser.parseRequest(context, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder().setRefId("A"))
          .build());
      fail("Expected MissingDataSourceException");
    } catch (MissingDataSourceException e) { }

    final MockSpan parse = trace.span("QueryParser.parseRequest");
    assertEquals("Error", parse.tags.get("status"));
    assertTrue(parse.exceptions.get("error")
        instanceof MissingDataSourceException);
    assertEquals("Error", trace.span("QueryParser.resolveTarget")
        .tags.get("status"));
    assertNull(trace.span("LegacyFieldsStrategy.lookup"));
  }

  private static QuerySpec.Builder query(final String ref_id,
                                         final String type,
                                         final String uid) {
    return QuerySpec.newBuilder()
        .setRefId(ref_id)
        .setDataSource(type, uid);
  }

  private static List<String> refIds(final SubRequest request) {
    final List<String> ids = Lists.newArrayList();
    for (final QuerySpec query : request.getRequest().getQueries()) {
      ids.add(query.getRefId());
    }
    return ids;
  }
}
