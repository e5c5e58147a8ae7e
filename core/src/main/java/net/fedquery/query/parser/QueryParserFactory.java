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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.fedquery.configuration.QueryParserConfig;
import net.fedquery.query.ExpressionTypeReader;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.expression.DefaultExpressionTypeReader;
import net.fedquery.query.legacy.ConfiguredLegacyDataSourceRetriever;

/**
 * Builds {@link QueryParser}s from a {@link QueryParserConfig}. The reader
 * and retriever default to {@link DefaultExpressionTypeReader} and, when
 * data sources are configured, {@link ConfiguredLegacyDataSourceRetriever}.
 * Either can be replaced with a caller supplied implementation.
 *
 * @since 1.0
 */
public class QueryParserFactory {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryParserFactory.class);

  private final QueryParserConfig config;

  /** Ctor that loads the config via {@link QueryParserConfig#load()}. */
  public QueryParserFactory() {
    this(QueryParserConfig.load());
  }

  /**
   * Default ctor.
   * @param config A non-null config.
   */
  public QueryParserFactory(final QueryParserConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
  }

  /** @return A parser using the configured reader and retriever. */
  public QueryParser newParser() {
    return newParser(newReader(), newRetriever());
  }

  /**
   * @param retriever A retriever to use in place of the configured one, may
   * be null to disable legacy lookups.
   * @return A parser.
   */
  public QueryParser newParser(final LegacyDataSourceRetriever retriever) {
    return newParser(newReader(), retriever);
  }

  /**
   * @param reader A non-null reader.
   * @param retriever The retriever, may be null.
   * @return A parser.
   */
  public QueryParser newParser(final ExpressionTypeReader reader,
                               final LegacyDataSourceRetriever retriever) {
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    LOG.info("Building query parser with config: " + config);
    return new QueryParser(reader, retriever, config.getLegacyTimeout());
  }

  /** @return The config. */
  public QueryParserConfig config() {
    return config;
  }

  private ExpressionTypeReader newReader() {
    return new DefaultExpressionTypeReader(config.isSqlExpressionsEnabled());
  }

  private LegacyDataSourceRetriever newRetriever() {
    if (config.getDataSources().isEmpty()) {
      return null;
    }
    return new ConfiguredLegacyDataSourceRetriever(config.getDataSources());
  }
}
