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
package net.fedquery.query.legacy;

import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.fedquery.common.Const;
import net.fedquery.configuration.LegacyDataSourceEntry;
import net.fedquery.data.DataSourceRef;
import net.fedquery.exceptions.DataSourceNotFoundException;
import net.fedquery.exceptions.MissingLegacyParameterException;
import net.fedquery.exceptions.QueryParseCanceled;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.QueryParseContext;

/**
 * A legacy retriever backed by a static list of data sources, typically the
 * {@code dataSources} section of the parser config. Lookups never block so
 * the deferreds are always already resolved.
 *
 * @since 1.0
 */
public class ConfiguredLegacyDataSourceRetriever
    implements LegacyDataSourceRetriever {

  /** Entries keyed on their numeric ID. */
  private final Map<Long, LegacyDataSourceEntry> by_id;

  /** Entries keyed on their name. */
  private final Map<String, LegacyDataSourceEntry> by_name;

  /**
   * Default ctor.
   * @param entries A non-null list of validated entries.
   * @throws IllegalArgumentException if two entries share an ID or a name.
   */
  public ConfiguredLegacyDataSourceRetriever(
      final List<LegacyDataSourceEntry> entries) {
    if (entries == null) {
      throw new IllegalArgumentException("Entries cannot be null.");
    }
    final Map<Long, LegacyDataSourceEntry> ids = Maps.newHashMap();
    final Map<String, LegacyDataSourceEntry> names = Maps.newHashMap();
    for (final LegacyDataSourceEntry entry : entries) {
      if (entry.getId() != 0 && ids.put(entry.getId(), entry) != null) {
        throw new IllegalArgumentException("Duplicate data source id: "
            + entry.getId());
      }
      if (!Strings.isNullOrEmpty(entry.getName())
          && names.put(entry.getName(), entry) != null) {
        throw new IllegalArgumentException("Duplicate data source name: "
            + entry.getName());
      }
    }
    by_id = ids;
    by_name = names;
  }

  @Override
  public Deferred<DataSourceRef> getDataSourceFromDeprecatedFields(
      final QueryParseContext context,
      final String name,
      final long id) {
    if (context.isCanceled()) {
      return Deferred.fromError(new QueryParseCanceled(
          "Legacy lookup canceled.", Const.CLIENT_CLOSED_REQUEST, null));
    }
    if (id != 0) {
      final LegacyDataSourceEntry entry = by_id.get(id);
      if (entry != null) {
        return Deferred.fromResult(entry.toRef());
      }
      if (Strings.isNullOrEmpty(name)) {
        return Deferred.fromError(new DataSourceNotFoundException(
            "no datasource with id " + id));
      }
    }
    if (!Strings.isNullOrEmpty(name)) {
      final LegacyDataSourceEntry entry = by_name.get(name);
      if (entry != null) {
        return Deferred.fromResult(entry.toRef());
      }
      return Deferred.fromError(new DataSourceNotFoundException(
          "no datasource named " + name));
    }
    return Deferred.fromError(new MissingLegacyParameterException());
  }
}
