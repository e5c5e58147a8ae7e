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
 * Thrown when a reference ID, including the empty ID, appears more than
 * once in a request.
 *
 * @since 1.0
 */
public class DuplicateRefIdException extends QueryParseException {
  private static final long serialVersionUID = 2896632120384126311L;

  /** The index of the repeated occurrence. */
  private final int index;

  /**
   * Default ctor.
   * @param ref_id The duplicated reference ID.
   * @param index The index of the second occurrence in the query list.
   */
  public DuplicateRefIdException(final String ref_id, final int index) {
    super("Duplicate refId " + quote(ref_id) + " at query index " + index,
        Const.BAD_REQUEST, ref_id);
    this.index = index;
  }

  /** @return The index of the repeated occurrence. */
  public int getIndex() {
    return index;
  }
}
