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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.fedquery.common.Const;
import net.fedquery.data.DataSourceRef;
import net.fedquery.data.QuerySpec;
import net.fedquery.exceptions.DataSourceNotFoundException;
import net.fedquery.exceptions.LegacyResolutionException;
import net.fedquery.exceptions.QueryParseCanceled;
import net.fedquery.query.LegacyDataSourceRetriever;
import net.fedquery.query.QueryParseContext;
import net.fedquery.stats.Span;

/**
 * Last step of the chain: resolves queries that only carry the deprecated
 * data source name or numeric ID through a {@link LegacyDataSourceRetriever}.
 * A modern reference with a UID but no type is treated as a legacy name.
 * <p>
 * The retriever's deferred is joined with the smaller of the caller's
 * remaining time and the configured per lookup timeout. If the caller's
 * deadline is what ran out the parse is canceled, otherwise the lookup
 * failure is reported against the query.
 *
 * @since 1.0
 */
public class LegacyFieldsStrategy implements TargetResolutionStrategy {
  private static final Logger LOG =
      LoggerFactory.getLogger(LegacyFieldsStrategy.class);

  public static final String ID = "legacy";

  /** The retriever, may be null when no lookup is configured. */
  private final LegacyDataSourceRetriever retriever;

  /** Per lookup timeout in ms, 0 for none. */
  private final long timeout;

  /**
   * Default ctor.
   * @param retriever The retriever, may be null in which case queries that
   * need it fail.
   * @param timeout A per lookup timeout in ms, 0 to rely on the context.
   * @throws IllegalArgumentException if the timeout was negative.
   */
  public LegacyFieldsStrategy(final LegacyDataSourceRetriever retriever,
                              final long timeout) {
    if (timeout < 0) {
      throw new IllegalArgumentException("Timeout cannot be negative.");
    }
    this.retriever = retriever;
    this.timeout = timeout;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ResolvedTarget resolve(final QueryParseContext context,
                                final QuerySpec query) {
    final DataSourceRef ref = query.getDataSource();
    final boolean uid_only = ref != null
        && Strings.isNullOrEmpty(ref.getType())
        && !Strings.isNullOrEmpty(ref.getUid());
    if (!query.hasDeprecatedFields() && !uid_only) {
      return null;
    }

    final String name;
    if (!Strings.isNullOrEmpty(query.getDataSourceName())) {
      name = query.getDataSourceName();
    } else {
      name = uid_only ? ref.getUid() : null;
    }
    final long id = query.getDataSourceId();
    LOG.warn("Query \"{}\" uses deprecated datasource fields, name: {} id: {}",
        query.getRefId(), name, id);

    if (retriever == null) {
      throw new LegacyResolutionException(query.getRefId(),
          new UnsupportedOperationException(
              "No legacy datasource retriever configured."));
    }

    final Span child;
    if (context.span() != null) {
      child = context.span().newChild(getClass().getSimpleName()
            + ".lookup")
          .withTag("id", id)
          .start();
      if (name != null) {
        child.setTag("name", name);
      }
    } else {
      child = null;
    }

    final ResolvedTarget target;
    try {
      target = toTarget(query.getRefId(),
          lookup(context, query.getRefId(), name, id));
    } catch (RuntimeException e) {
      if (child != null) {
        child.setErrorTags(e).finish();
      }
      throw e;
    }
    if (child != null) {
      child.setSuccessTags()
           .setTag("pluginId", target.getPluginId())
           .setTag("uid", target.getUid())
           .finish();
    }
    return target;
  }

  /** @return The per lookup timeout in ms. */
  public long timeout() {
    return timeout;
  }

  private DataSourceRef lookup(final QueryParseContext context,
                               final String ref_id,
                               final String name,
                               final long id) {
    final Deferred<DataSourceRef> deferred;
    try {
      deferred = retriever.getDataSourceFromDeprecatedFields(
          context, name, id);
    } catch (QueryParseCanceled e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LegacyResolutionException(ref_id, e);
    }
    if (deferred == null) {
      throw new LegacyResolutionException(ref_id,
          new IllegalStateException("Retriever returned a null deferred."));
    }

    final long remaining = context.remainingMillis(System.currentTimeMillis());
    if (remaining == 0) {
      throw new QueryParseCanceled("Query parse deadline exceeded.",
          Const.REQUEST_TIMEOUT, ref_id);
    }
    // whichever bound is smaller decides what a timeout means
    final boolean deadline_bound = timeout <= 0 || remaining <= timeout;
    final long wait = deadline_bound ? remaining : timeout;

    try {
      if (wait == Long.MAX_VALUE) {
        return deferred.join();
      }
      return deferred.join(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryParseCanceled("Interrupted while resolving the legacy "
          + "datasource.", Const.CLIENT_CLOSED_REQUEST, ref_id, e);
    } catch (QueryParseCanceled e) {
      throw e;
    } catch (Exception e) {
      if (e instanceof TimeoutException && deadline_bound) {
        throw new QueryParseCanceled("Query parse deadline exceeded while "
            + "resolving the legacy datasource.", Const.REQUEST_TIMEOUT,
            ref_id, e);
      }
      throw new LegacyResolutionException(ref_id, e);
    }
  }

  private static ResolvedTarget toTarget(final String ref_id,
                                         final DataSourceRef ref) {
    if (ref == null) {
      throw new LegacyResolutionException(ref_id,
          new DataSourceNotFoundException("Retriever returned no datasource."));
    }
    if (Const.BUILTIN_DATASOURCE_UID.equals(ref.getUid())) {
      return ResolvedTarget.BUILTIN;
    }
    if (Const.EXPRESSION_DATASOURCE_UID.equals(ref.getUid())) {
      return ResolvedTarget.EXPRESSION;
    }
    if (Strings.isNullOrEmpty(ref.getType())
        || Strings.isNullOrEmpty(ref.getUid())) {
      throw new LegacyResolutionException(ref_id,
          new IllegalStateException("Retriever returned an incomplete "
              + "reference [" + ref + "]"));
    }
    return new ResolvedTarget(ref.getType(), ref.getUid());
  }
}
