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
package net.fedquery.query.expression;

import net.fedquery.common.Const;
import net.fedquery.data.QuerySpec;
import net.fedquery.query.ExpressionType;
import net.fedquery.query.ExpressionTypeReader;
import net.fedquery.query.QueryParseContext;

/**
 * Reads the expression sub-type from the {@code type} property of the query
 * payload. SQL expressions are gated behind a flag given at construction.
 * The expression text itself is never inspected.
 *
 * @since 1.0
 */
public class DefaultExpressionTypeReader implements ExpressionTypeReader {

  /** Whether or not SQL expressions are accepted. */
  private final boolean sql_expressions_enabled;

  /**
   * Default ctor.
   * @param sql_expressions_enabled Whether or not SQL expressions are
   * accepted.
   */
  public DefaultExpressionTypeReader(final boolean sql_expressions_enabled) {
    this.sql_expressions_enabled = sql_expressions_enabled;
  }

  @Override
  public ExpressionType readExpressionType(final QueryParseContext context,
                                           final QuerySpec query) {
    final Object raw = query.getProperty(Const.EXPRESSION_TYPE_KEY);
    if (raw == null) {
      throw new IllegalArgumentException("missing expression type");
    }
    if (!(raw instanceof String)) {
      throw new IllegalArgumentException("expression type must be a string");
    }
    final ExpressionType type = ExpressionType.fromString((String) raw);
    if (type == ExpressionType.SQL && !sql_expressions_enabled) {
      throw new IllegalArgumentException("sql expressions are disabled");
    }
    return type;
  }

  /** @return Whether or not SQL expressions are accepted. */
  public boolean sqlExpressionsEnabled() {
    return sql_expressions_enabled;
  }
}
