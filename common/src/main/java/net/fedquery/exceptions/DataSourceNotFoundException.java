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
 * Thrown by legacy data source retrievers when the given name or numeric
 * ID does not match a known data source.
 *
 * @since 1.0
 */
public class DataSourceNotFoundException extends RuntimeException {
  private static final long serialVersionUID = -8051790326414125562L;

  /**
   * @param msg A non-null message to be given.
   */
  public DataSourceNotFoundException(final String msg) {
    super(msg);
  }
}
