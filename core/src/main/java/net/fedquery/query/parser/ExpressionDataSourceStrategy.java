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

import com.google.common.base.Strings;

import net.fedquery.common.Const;
import net.fedquery.data.DataSourceRef;
import net.fedquery.data.QuerySpec;
import net.fedquery.query.QueryParseContext;

/**
 * Routes server side expressions. Recognizes the expression UID on the
 * modern reference as well as the older forms: the expression name in the
 * deprecated name field or the reserved numeric ID. The older forms are
 * ignored when the query carries a complete modern reference.
 *
 * @since 1.0
 */
public class ExpressionDataSourceStrategy implements TargetResolutionStrategy {
  public static final String ID = "expression";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ResolvedTarget resolve(final QueryParseContext context,
                                final QuerySpec query) {
    final DataSourceRef ref = query.getDataSource();
    if (ref != null && Const.EXPRESSION_DATASOURCE_UID.equals(ref.getUid())) {
      return ResolvedTarget.EXPRESSION;
    }
    // a complete modern reference outranks the deprecated fields
    if (ref != null && !Strings.isNullOrEmpty(ref.getType())
        && !Strings.isNullOrEmpty(ref.getUid())) {
      return null;
    }
    if (Const.EXPRESSION_DATASOURCE_UID.equals(query.getDataSourceName())
        || query.getDataSourceId() == Const.EXPRESSION_DATASOURCE_LEGACY_ID) {
      return ResolvedTarget.EXPRESSION;
    }
    return null;
  }
}
