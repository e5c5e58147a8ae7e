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
 * Thrown when a query carries neither a data source reference nor any of
 * the deprecated data source fields.
 *
 * @since 1.0
 */
public class MissingDataSourceException extends QueryParseException {
  private static final long serialVersionUID = -1357106418260823617L;

  /**
   * Default ctor.
   * @param ref_id The reference ID of the query.
   */
  public MissingDataSourceException(final String ref_id) {
    super("Missing datasource for query " + quote(ref_id),
        Const.BAD_REQUEST, ref_id);
  }
}
