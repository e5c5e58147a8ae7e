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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * The sub-types of expression queries computed in-process from the results
 * of other queries.
 *
 * @since 1.0
 */
public enum ExpressionType {
  MATH("math"),
  REDUCE("reduce"),
  RESAMPLE("resample"),
  CLASSIC_CONDITIONS("classic_conditions"),
  THRESHOLD("threshold"),
  SQL("sql");

  /** The name used on the wire. */
  private final String wire_name;

  private ExpressionType(final String name) {
    this.wire_name = name;
  }

  /** @return The name used on the wire. */
  @JsonValue
  public String getName() {
    return wire_name;
  }

  /**
   * Parses the wire name, case insensitive.
   * @param name A non-null and non-empty name.
   * @return The matching type.
   * @throws IllegalArgumentException if the name was null, empty or unknown.
   */
  @JsonCreator
  public static ExpressionType fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Expression type cannot be null "
          + "or empty.");
    }
    for (final ExpressionType type : values()) {
      if (type.wire_name.equalsIgnoreCase(name.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown expression type: " + name);
  }
}
