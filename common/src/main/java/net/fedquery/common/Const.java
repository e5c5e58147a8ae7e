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
package net.fedquery.common;

/**
 * Reserved identifiers shared by the request model and the parser.
 *
 * @since 1.0
 */
public final class Const {

  /** UID and plugin ID of the built-in virtual data source. It is never
   * looked up in a registry. */
  public static final String BUILTIN_DATASOURCE_UID = "builtin";

  /** UID and plugin ID of the expression pseudo-target. */
  public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

  /** Legacy numeric ID some old clients send for expressions. */
  public static final long EXPRESSION_DATASOURCE_LEGACY_ID = -100L;

  /** Payload key carrying the expression sub-type. */
  public static final String EXPRESSION_TYPE_KEY = "type";

  /** Payload key carrying the raw expression text. */
  public static final String EXPRESSION_KEY = "expression";

  /** Literal used for both ends of the zero time range. */
  public static final String ZERO_TIME = "0";

  /** Status code for requests that failed validation or resolution. */
  public static final int BAD_REQUEST = 400;

  /** Status code when a parse ran past the caller's deadline. */
  public static final int REQUEST_TIMEOUT = 408;

  /** Status code when the caller canceled the parse. */
  public static final int CLIENT_CLOSED_REQUEST = 499;

  private Const() { }
}
