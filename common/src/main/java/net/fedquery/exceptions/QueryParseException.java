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

import com.google.common.base.Strings;

/**
 * High level exception thrown by any stage of request parsing. It bubbles up
 * to the caller who must reject the whole client request. Every instance
 * carries a status code and, where one applies, the reference ID of the
 * offending query.
 *
 * @since 1.0
 */
public class QueryParseException extends RuntimeException {
  private static final long serialVersionUID = -4418023906147723611L;

  /** A status code associated with the exception, e.g. HTTP code. */
  protected final int status_code;

  /** The reference ID of the offending query. May be null for request
   * level failures. */
  protected final String ref_id;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   */
  public QueryParseException(final String msg, final int status_code) {
    this(msg, status_code, null, null);
  }

  /**
   * Ctor that names the offending query.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param ref_id The reference ID of the query, may be null.
   */
  public QueryParseException(final String msg,
                             final int status_code,
                             final String ref_id) {
    this(msg, status_code, ref_id, null);
  }

  /**
   * Ctor that names the offending query and the underlying cause.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param ref_id The reference ID of the query, may be null.
   * @param t The original exception that caused this to be thrown, may be
   * null.
   */
  public QueryParseException(final String msg,
                             final int status_code,
                             final String ref_id,
                             final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    this.ref_id = ref_id;
  }

  /** @return The status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return The reference ID of the offending query, may be null. */
  public String getRefId() {
    return ref_id;
  }

  /**
   * Quotes a reference ID for messages so the empty ID stays visible.
   * @param ref_id The ID, may be null.
   * @return The ID wrapped in quotes.
   */
  protected static String quote(final String ref_id) {
    return "\"" + Strings.nullToEmpty(ref_id) + "\"";
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (ref_id != null) {
      buf.append(" refId=")
         .append(quote(ref_id));
    }
    return buf.toString();
  }
}
