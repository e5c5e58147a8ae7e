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

import net.fedquery.common.Const;
import net.fedquery.data.DataSourceRef;
import net.fedquery.data.QuerySpec;
import net.fedquery.query.QueryParseContext;

/**
 * Routes queries that reference the built-in data source UID, with or
 * without a type. Never consults the legacy retriever.
 *
 * @since 1.0
 */
public class BuiltInDataSourceStrategy implements TargetResolutionStrategy {
  public static final String ID = "builtin";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ResolvedTarget resolve(final QueryParseContext context,
                                final QuerySpec query) {
    final DataSourceRef ref = query.getDataSource();
    if (ref != null && Const.BUILTIN_DATASOURCE_UID.equals(ref.getUid())) {
      return ResolvedTarget.BUILTIN;
    }
    return null;
  }
}
