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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.fedquery.data.QuerySpec;
import net.fedquery.data.TimeRange;
import net.fedquery.exceptions.InvalidTimeRangeException;

public class TestTimeRangeResolver {
  private static final TimeRange GLOBAL = new TimeRange("now-1h", "now");

  private final TimeRangeResolver resolver = new TimeRangeResolver();

  @Test
  public void queryRangeWins() throws Exception {
    final QuerySpec query = QuerySpec.newBuilder()
        .setRefId("A")
        .setTimeRange("now-1d", "now")
        .build();
    assertEquals(new TimeRange("now-1d", "now"),
        resolver.resolve(GLOBAL, query));
  }

  @Test
  public void globalWhenQueryHasNone() throws Exception {
    final QuerySpec query = QuerySpec.newBuilder()
        .setRefId("A")
        .build();
    assertSame(GLOBAL, resolver.resolve(GLOBAL, query));

    // an empty override is the same as none
    final QuerySpec empty = QuerySpec.newBuilder()
        .setRefId("A")
        .setTimeRange("", "")
        .build();
    assertSame(GLOBAL, resolver.resolve(GLOBAL, empty));
  }

  @Test
  public void zeroWhenNothingSet() throws Exception {
    final QuerySpec query = QuerySpec.newBuilder()
        .setRefId("A")
        .build();
    assertSame(TimeRange.ZERO, resolver.resolve(null, query));
    assertSame(TimeRange.ZERO, resolver.resolve(new TimeRange(null, null),
        query));
    assertEquals("0", resolver.resolve(new TimeRange("", ""), query)
        .getFrom());
    assertEquals("0", resolver.resolve(new TimeRange("", ""), query)
        .getTo());
  }

  @Test
  public void partialQueryRange() throws Exception {
    final QuerySpec query = QuerySpec.newBuilder()
        .setRefId("A")
        .setTimeRange("now-1h", null)
        .build();
    try {
      resolver.resolve(GLOBAL, query);
      fail("Expected InvalidTimeRangeException");
    } catch (InvalidTimeRangeException e) {
      assertEquals("A", e.getRefId());
      assertEquals(400, e.getStatusCode());
    }

    final QuerySpec to_only = QuerySpec.newBuilder()
        .setRefId("B")
        .setTimeRange("", "now")
        .build();
    try {
      resolver.resolve(GLOBAL, to_only);
      fail("Expected InvalidTimeRangeException");
    } catch (InvalidTimeRangeException e) {
      assertEquals("B", e.getRefId());
    }
  }

  @Test
  public void partialGlobalRange() throws Exception {
    final TimeRange partial = new TimeRange(null, "now");
    final QuerySpec query = QuerySpec.newBuilder()
        .setRefId("A")
        .build();
    try {
      resolver.resolve(partial, query);
      fail("Expected InvalidTimeRangeException");
    } catch (InvalidTimeRangeException e) {
      assertEquals("A", e.getRefId());
    }

    // not used so it's fine
    final QuerySpec with_range = QuerySpec.newBuilder()
        .setRefId("B")
        .setTimeRange("now-5m", "now")
        .build();
    assertEquals(new TimeRange("now-5m", "now"),
        resolver.resolve(partial, with_range));
  }
}
