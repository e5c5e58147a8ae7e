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

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.fedquery.data.QueryRequest;
import net.fedquery.data.QuerySpec;
import net.fedquery.data.TimeRange;

/**
 * Groups resolved queries by target. Groups are emitted in the order their
 * target first appears and each keeps its members in request order. A group
 * takes the effective range of its first member; members keep their own
 * range fields untouched.
 *
 * @since 1.0
 */
public class RequestPartitioner {
  private static final Logger LOG = LoggerFactory.getLogger(
      RequestPartitioner.class);

  /**
   * @param queries The non-null resolved queries in request order.
   * @return One sub-request per distinct target.
   */
  public List<SubRequest> partition(final List<ResolvedQuery> queries) {
    final Map<ResolvedTarget, List<ResolvedQuery>> groups =
        Maps.newLinkedHashMap();
    for (final ResolvedQuery query : queries) {
      List<ResolvedQuery> group = groups.get(query.target());
      if (group == null) {
        group = Lists.newArrayList();
        groups.put(query.target(), group);
      }
      group.add(query);
    }

    final ImmutableList.Builder<SubRequest> requests = ImmutableList.builder();
    for (final Entry<ResolvedTarget, List<ResolvedQuery>> entry :
        groups.entrySet()) {
      final List<ResolvedQuery> members = entry.getValue();
      final TimeRange range = members.get(0).timeRange();
      final List<QuerySpec> specs =
          Lists.newArrayListWithCapacity(members.size());
      for (final ResolvedQuery member : members) {
        if (!range.equals(member.timeRange()) && LOG.isDebugEnabled()) {
          LOG.debug("Query \"" + member.refId() + "\" range ["
              + member.timeRange() + "] differs from the range [" + range
              + "] of its group " + entry.getKey());
        }
        specs.add(member.query());
      }
      requests.add(new SubRequest(entry.getKey(), QueryRequest.newBuilder()
          .setTimeRange(range)
          .setQueries(specs)
          .build()));
    }
    return requests.build();
  }

  /**
   * @param queries The non-null resolved queries in request order.
   * @return An ordered map of reference ID to plugin ID.
   */
  public Map<String, String> refIdTypes(final List<ResolvedQuery> queries) {
    final Map<String, String> types = Maps.newLinkedHashMap();
    for (final ResolvedQuery query : queries) {
      types.put(query.refId(), query.target().getPluginId());
    }
    return types;
  }
}
