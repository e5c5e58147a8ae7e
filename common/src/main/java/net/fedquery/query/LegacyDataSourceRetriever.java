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
package net.fedquery.query;

import com.stumbleupon.async.Deferred;

import net.fedquery.data.DataSourceRef;

/**
 * Resolves the deprecated name and numeric ID fields of a query to a modern
 * data source reference. Implementations may perform I/O, must honor the
 * context's cancellation and should be safe for concurrent use.
 * <p>
 * Contract: a match by numeric ID takes precedence when the ID is non-zero;
 * otherwise a non-empty name is used. When neither is given the returned
 * deferred must resolve to a
 * {@link net.fedquery.exceptions.MissingLegacyParameterException}.
 *
 * @since 1.0
 */
public interface LegacyDataSourceRetriever {

  /**
   * Looks up the data source for the deprecated fields.
   * @param context The non-null context of the parse call.
   * @param name The deprecated name, may be null or empty.
   * @param id The deprecated numeric ID, 0 when absent.
   * @return A deferred resolving to the non-null reference or an exception.
   */
  public Deferred<DataSourceRef> getDataSourceFromDeprecatedFields(
      final QueryParseContext context,
      final String name,
      final long id);
}
