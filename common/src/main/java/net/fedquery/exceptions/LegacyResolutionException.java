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
package net.fedquery.exceptions;

import net.fedquery.common.Const;

/**
 * Wraps any failure of the legacy data source lookup for a query.
 *
 * @since 1.0
 */
public class LegacyResolutionException extends QueryParseException {
  private static final long serialVersionUID = 7316960021725372154L;

  /**
   * Default ctor.
   * @param ref_id The reference ID of the query.
   * @param t The non-null exception from the retriever.
   */
  public LegacyResolutionException(final String ref_id, final Throwable t) {
    super("Unable to resolve legacy datasource for query " + quote(ref_id)
        + ": " + t.getMessage(), Const.BAD_REQUEST, ref_id, t);
  }
}
