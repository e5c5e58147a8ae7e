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

import java.util.concurrent.atomic.AtomicBoolean;

import net.fedquery.common.Const;
import net.fedquery.exceptions.QueryParseCanceled;
import net.fedquery.stats.Span;

/**
 * The per-call context threaded through the parser and into the
 * collaborators. It carries an optional absolute deadline, a cancellation
 * flag the caller may flip from another thread and an optional tracing span
 * under which the parser opens its own children.
 *
 * @since 1.0
 */
public class QueryParseContext {

  /** Absolute deadline in Unix epoch milliseconds, 0 for none. */
  private final long deadline;

  /** Set when the caller gives up on the parse. */
  private final AtomicBoolean canceled;

  /** An optional parent span. */
  private final Span span;

  protected QueryParseContext(final Builder builder) {
    if (builder.deadline < 0) {
      throw new IllegalArgumentException("Deadline cannot be negative.");
    }
    deadline = builder.deadline;
    span = builder.span;
    canceled = new AtomicBoolean();
  }

  /**
   * Ctor for a derived context sharing the deadline and cancellation flag
   * of the parent.
   * @param parent The non-null parent context.
   * @param span The span for the derived context.
   */
  protected QueryParseContext(final QueryParseContext parent,
                              final Span span) {
    deadline = parent.deadline;
    canceled = parent.canceled;
    this.span = span;
  }

  /** @return A context with no deadline and no span. */
  public static QueryParseContext background() {
    return newBuilder().build();
  }

  /** @return The deadline in epoch milliseconds or 0 if none was set. */
  public long deadline() {
    return deadline;
  }

  /** @return True if a deadline was set. */
  public boolean hasDeadline() {
    return deadline > 0;
  }

  /**
   * @param now The current epoch time in milliseconds.
   * @return The milliseconds left before the deadline, 0 if it has passed
   * and {@link Long#MAX_VALUE} if there is no deadline.
   */
  public long remainingMillis(final long now) {
    if (deadline <= 0) {
      return Long.MAX_VALUE;
    }
    return Math.max(0, deadline - now);
  }

  /** Marks the parse as canceled. Safe to call from any thread. */
  public void cancel() {
    canceled.set(true);
  }

  /** @return True if {@link #cancel()} was called. */
  public boolean isCanceled() {
    return canceled.get();
  }

  /** @return The parent span, may be null. */
  public Span span() {
    return span;
  }

  /**
   * Returns a context that shares this context's deadline and cancellation
   * but hands out the given span to collaborators.
   * @param span The span, may be null to keep the current one.
   * @return A derived context, or this one if the span is null.
   */
  public QueryParseContext withSpan(final Span span) {
    if (span == null) {
      return this;
    }
    return new QueryParseContext(this, span);
  }

  /**
   * Throws if the caller canceled the parse or the deadline passed.
   * @param ref_id The query being processed, may be null.
   * @throws QueryParseCanceled if the parse must stop.
   */
  public void checkActive(final String ref_id) {
    if (canceled.get()) {
      throw new QueryParseCanceled("Query parse was canceled.",
          Const.CLIENT_CLOSED_REQUEST, ref_id);
    }
    if (deadline > 0 && remainingMillis(System.currentTimeMillis()) == 0) {
      throw new QueryParseCanceled("Query parse deadline exceeded.",
          Const.REQUEST_TIMEOUT, ref_id);
    }
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private long deadline;
    private Span span;

    /**
     * @param deadline An absolute epoch deadline in milliseconds, 0 for none.
     * @return The builder.
     */
    public Builder setDeadline(final long deadline) {
      this.deadline = deadline;
      return this;
    }

    /**
     * @param timeout A relative timeout in milliseconds from now.
     * @return The builder.
     */
    public Builder setTimeout(final long timeout) {
      if (timeout <= 0) {
        throw new IllegalArgumentException("Timeout must be greater than 0.");
      }
      deadline = System.currentTimeMillis() + timeout;
      return this;
    }

    public Builder setSpan(final Span span) {
      this.span = span;
      return this;
    }

    public QueryParseContext build() {
      return new QueryParseContext(this);
    }
  }
}
