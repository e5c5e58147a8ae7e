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
package net.fedquery.query.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.fedquery.common.Const;

/**
 * The downstream target a query is routed to: the plugin that executes it
 * and the data source instance UID. Used as the grouping key when the
 * request is partitioned so equality is on both fields.
 *
 * @since 1.0
 */
public class ResolvedTarget {

  /** Target for the engine's built-in data source. */
  public static final ResolvedTarget BUILTIN = new ResolvedTarget(
      Const.BUILTIN_DATASOURCE_UID, Const.BUILTIN_DATASOURCE_UID);

  /** Target for server side expressions. */
  public static final ResolvedTarget EXPRESSION = new ResolvedTarget(
      Const.EXPRESSION_DATASOURCE_UID, Const.EXPRESSION_DATASOURCE_UID);

  /** The plugin ID. */
  private final String plugin_id;

  /** The instance UID. */
  private final String uid;

  /**
   * Default ctor.
   * @param plugin_id A non-null and non-empty plugin ID.
   * @param uid A non-null and non-empty instance UID.
   * @throws IllegalArgumentException if either value was null or empty.
   */
  public ResolvedTarget(final String plugin_id, final String uid) {
    if (Strings.isNullOrEmpty(plugin_id)) {
      throw new IllegalArgumentException("Plugin ID cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(uid)) {
      throw new IllegalArgumentException("UID cannot be null or empty.");
    }
    this.plugin_id = plugin_id;
    this.uid = uid;
  }

  /** @return The plugin ID. */
  public String getPluginId() {
    return plugin_id;
  }

  /** @return The instance UID. */
  public String getUid() {
    return uid;
  }

  /** @return True if this is the expression target. */
  @JsonIgnore
  public boolean isExpression() {
    return Const.EXPRESSION_DATASOURCE_UID.equals(plugin_id);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ResolvedTarget other = (ResolvedTarget) o;
    return Objects.equal(plugin_id, other.plugin_id)
        && Objects.equal(uid, other.uid);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(plugin_id, uid);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("pluginId=")
        .append(plugin_id)
        .append(", uid=")
        .append(uid)
        .toString();
  }
}
