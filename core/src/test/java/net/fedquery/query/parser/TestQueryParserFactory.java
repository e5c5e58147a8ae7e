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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.fedquery.configuration.LegacyDataSourceEntry;
import net.fedquery.configuration.QueryParserConfig;
import net.fedquery.data.QueryRequest;
import net.fedquery.data.QuerySpec;
import net.fedquery.exceptions.InvalidExpressionException;
import net.fedquery.exceptions.LegacyResolutionException;
import net.fedquery.query.QueryParseContext;
import net.fedquery.query.expression.DefaultExpressionTypeReader;

public class TestQueryParserFactory {
  private static final QueryParseContext CONTEXT =
      QueryParseContext.background();

  @Test
  public void ctor() throws Exception {
    try {
      new QueryParserFactory(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final QueryParserConfig config = QueryParserConfig.newBuilder().build();
    assertSame(config, new QueryParserFactory(config).config());

    // bundled defaults
    assertEquals(0, new QueryParserFactory().config().getLegacyTimeout());
  }

  @Test
  public void defaults() throws Exception {
    final QueryParser parser = new QueryParserFactory(
        QueryParserConfig.newBuilder().build()).newParser();

    try {
      parser.parseRequest(CONTEXT, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("B")
              .setDataSource("__expr__", "__expr__")
              .addProperty("type", "sql"))
          .build());
      fail("Expected InvalidExpressionException");
    } catch (InvalidExpressionException e) { }

    // no data sources configured so no lookups
    try {
      parser.parseRequest(CONTEXT, QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceId(100))
          .build());
      fail("Expected LegacyResolutionException");
    } catch (LegacyResolutionException e) {
      assertEquals(UnsupportedOperationException.class,
          e.getCause().getClass());
    }
  }

  @Test
  public void configured() throws Exception {
    final QueryParser parser = new QueryParserFactory(
        QueryParserConfig.newBuilder()
          .setSqlExpressionsEnabled(true)
          .setLegacyTimeout(1000)
          .addDataSource(LegacyDataSourceEntry.newBuilder()
              .setId(100)
              .setType("plugin-aaaa")
              .setUid("AAA")
              .build())
          .build()).newParser();

    final ParsedRequestInfo info = parser.parseRequest(CONTEXT,
        QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceId(100))
          .addQuery(QuerySpec.newBuilder()
              .setRefId("B")
              .setDataSource("__expr__", "__expr__")
              .addProperty("type", "sql")
              .addProperty("expression", "SELECT * FROM A"))
          .build());
    assertEquals(2, info.getRequests().size());
    assertEquals(new ResolvedTarget("plugin-aaaa", "AAA"),
        info.getRequests().get(0).getTarget());
    assertEquals(1, info.getSqlInputs().size());
  }

  @Test
  public void overrides() throws Exception {
    final MockLegacyRetriever retriever = new MockLegacyRetriever();
    final QueryParserFactory factory = new QueryParserFactory(
        QueryParserConfig.newBuilder().build());
    QueryParser parser = factory.newParser(retriever);
    ParsedRequestInfo info = parser.parseRequest(CONTEXT,
        QueryRequest.newBuilder()
          .addQuery(QuerySpec.newBuilder()
              .setRefId("A")
              .setDataSourceName("old"))
          .build());
    assertEquals(new ResolvedTarget("plugin-bbb", "old"),
        info.getRequests().get(0).getTarget());
    assertEquals(1, retriever.calls.get());

    parser = factory.newParser(new DefaultExpressionTypeReader(true), null);
    info = parser.parseRequest(CONTEXT, QueryRequest.newBuilder()
        .addQuery(QuerySpec.newBuilder()
            .setRefId("B")
            .setDataSource("__expr__", "__expr__")
            .addProperty("type", "sql"))
        .build());
    assertEquals(1, info.getSqlInputs().size());

    try {
      factory.newParser(null, retriever);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
