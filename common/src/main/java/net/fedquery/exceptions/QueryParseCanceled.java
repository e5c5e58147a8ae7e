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

/**
 * Exception bubbled up when a parse is canceled or runs past its deadline.
 *
 * @since 1.0
 */
public class QueryParseCanceled extends QueryParseException {
  private static final long serialVersionUID = -2872091035366001265L;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param ref_id The query being processed, may be null.
   */
  public QueryParseCanceled(final String msg,
                            final int status_code,
                            final String ref_id) {
    super(msg, status_code, ref_id);
  }

  /**
   * Ctor with the original exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param ref_id The query being processed, may be null.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryParseCanceled(final String msg,
                            final int status_code,
                            final String ref_id,
                            final Throwable t) {
    super(msg, status_code, ref_id, t);
  }
}
