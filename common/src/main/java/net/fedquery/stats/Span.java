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

/**
 * A tracing span supplied by the caller of the parser. Callers without a
 * tracer leave the span null and the parser skips tracing entirely.
 *
 * @since 1.0
 */
public interface Span {

  /**
   * Called when the span measurement is finished and records the duration
   * of the span from the time {@link SpanBuilder#start()} was called. No more
   * tags can be set after this point.
   */
  public void finish();

  /**
   * Sets the tags "status=OK" and "finalThread=&lt;local_thread_name&gt;".
   * @return The span.
   */
  public Span setSuccessTags();

  /**
   * Sets the tags "status=Error" and "finalThread=&lt;local_thread_name&gt;"
   * and records the exception under "error".
   * @param t A non-null exception.
   * @return The span.
   */
  public Span setErrorTags(final Throwable t);

  /**
   * Sets a tag on a span. May overwrite.
   * @param key A non-null and non-empty key.
   * @param value A non-null and non-empty value.
   * @return The span.
   */
  public Span setTag(final String key, final String value);

  /**
   * Sets a tag on a span. May overwrite.
   * @param key A non-null and non-empty key.
   * @param value A numeric value.
   * @return The span.
   */
  public Span setTag(final String key, final Number value);

  /**
   * Creates a new child span from the current span.
   * @param id A non-null and non-empty span ID.
   * @return A new span builder with this span as the parent.
   * @throws IllegalArgumentException if the ID was null or empty.
   */
  public SpanBuilder newChild(final String id);

  /**
   * The builder used to construct and start a span.
   */
  public interface SpanBuilder {
    /**
     * Sets a tag on the span.
     * @param key A non-null and non-empty key.
     * @param value A non-null and non-empty value.
     * @return The span builder.
     */
    public SpanBuilder withTag(final String key, final String value);

    /**
     * Sets a tag on the span.
     * @param key A non-null and non-empty key.
     * @param value A numeric value.
     * @return The span builder.
     */
    public SpanBuilder withTag(final String key, final Number value);

    /**
     * Constructs the span and records the current timestamp for timing
     * purposes.
     * @return The started span.
     */
    public Span start();
  }
}
