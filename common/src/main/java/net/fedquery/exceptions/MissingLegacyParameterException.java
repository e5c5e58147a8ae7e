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
 * Thrown by legacy data source retrievers when neither a numeric ID nor a
 * name was supplied.
 *
 * @since 1.0
 */
public class MissingLegacyParameterException extends IllegalArgumentException {
  private static final long serialVersionUID = 3419278146627520034L;

  public MissingLegacyParameterException() {
    super("missing parameter");
  }

  /**
   * @param msg A non-null message to be given.
   */
  public MissingLegacyParameterException(final String msg) {
    super(msg);
  }
}
