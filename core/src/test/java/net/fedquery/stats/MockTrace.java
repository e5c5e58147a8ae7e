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
package net.fedquery.stats;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.fedquery.stats.Span.SpanBuilder;

/**
 * Mock tracer for unit tests. Finished spans are recorded in finish order.
 */
public class MockTrace {
  public final AtomicLong span_timestamp = new AtomicLong();
  public List<MockSpan> spans = Lists.newArrayList();
  public Span first_span;

  /**
   * @param id A span ID.
   * @return A builder for a root span. The first root started is kept in
   * {@link #first_span}.
   */
  public SpanBuilder newSpan(final String id) {
    Builder builder = new Builder().buildSpan(id);
    if (first_span == null) {
      builder.is_first = true;
    }
    return builder;
  }

  /**
   * @param id A span ID.
   * @return The first finished span with the ID or null if not found.
   */
  public MockSpan span(final String id) {
    synchronized (this) {
      for (final MockSpan span : spans) {
        if (span.id.equals(id)) {
          return span;
        }
      }
    }
    return null;
  }

  /**
   * @param id A span ID.
   * @return The number of finished spans with the ID.
   */
  public int count(final String id) {
    int count = 0;
    synchronized (this) {
      for (final MockSpan span : spans) {
        if (span.id.equals(id)) {
          count++;
        }
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("spans=")
        .append(spans)
        .toString();
  }

  public class MockSpan implements Span {
    public String id;
    public Span parent;
    public final long start;
    public long end;
    public Map<String, Object> tags;
    public Map<String, Throwable> exceptions;

    protected MockSpan(final Builder builder) {
      if (Strings.isNullOrEmpty(builder.id)) {
        throw new IllegalArgumentException("Span ID cannot be null.");
      }
      start = span_timestamp.getAndIncrement();
      id = builder.id;
      parent = builder.parent;
      tags = builder.tags;
    }

    @Override
    public void finish() {
      end = span_timestamp.getAndIncrement();
      synchronized (MockTrace.this) {
        spans.add(this);
      }
    }

    @Override
    public Span setSuccessTags() {
      setTag("status", "OK");
      setTag("finalThread", Thread.currentThread().getName());
      return this;
    }

    private Span setErrorTags() {
      setTag("status", "Error");
      setTag("finalThread", Thread.currentThread().getName());
      return this;
    }

    @Override
    public Span setErrorTags(final Throwable t) {
      setErrorTags();
      if (exceptions == null) {
        exceptions = Maps.newHashMap();
      }
      exceptions.put("error", t);
      return this;
    }

    @Override
    public Span setTag(final String key, final String value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      }
      tags.put(key, value);
      return this;
    }

    @Override
    public Span setTag(final String key, final Number value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      }
      tags.put(key, value);
      return this;
    }

    @Override
    public SpanBuilder newChild(final String id) {
      return new Builder().buildSpan(id)
          .asChildOf(this);
    }

    @Override
    public String toString() {
      return new StringBuilder()
          .append("id=")
          .append(id)
          .append(", parent=[")
          .append(parent == null ? "null" : ((MockSpan) parent).id)
          .append("], start=")
          .append(start)
          .append(", end=")
          .append(end)
          .append(", tags=")
          .append(tags)
          .toString();
    }
  }

  public class Builder implements SpanBuilder {
    private String id;
    private Span parent;
    private Map<String, Object> tags;
    private boolean is_first;

    Builder asChildOf(final Span parent) {
      this.parent = parent;
      return this;
    }

    @Override
    public SpanBuilder withTag(final String key, final String value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      }
      tags.put(key, value);
      return this;
    }

    @Override
    public SpanBuilder withTag(final String key, final Number value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      }
      tags.put(key, value);
      return this;
    }

    Builder buildSpan(final String id) {
      this.id = id;
      return this;
    }

    @Override
    public Span start() {
      if (is_first) {
        first_span = new MockSpan(this);
        return first_span;
      }
      return new MockSpan(this);
    }
  }
}
