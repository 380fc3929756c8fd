package com.gentoro.mistadopt.fetch;

import com.gentoro.mistadopt.exception.FetchException;
import com.gentoro.mistadopt.inventory.FetchKey;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-scoped, single-flight cache of adoption configurations keyed by {@link FetchKey}.
 *
 * <p>The first caller for a key performs the remote fetch on its own thread; callers arriving while
 * that fetch is in flight wait for the same result. Successful results are kept for the lifetime
 * of the cache. A failed fetch is delivered to everyone already waiting on it and then forgotten,
 * so the next caller for that key starts a fresh fetch.
 */
public class AdoptionConfigCache {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(AdoptionConfigCache.class);

  private final AdoptionConfigClient client;
  private final String apiKey;
  private final Map<FetchKey, CompletableFuture<RawConfig>> entries = new ConcurrentHashMap<>();
  private final AtomicInteger fetchCount = new AtomicInteger();

  public AdoptionConfigCache(AdoptionConfigClient client, String apiKey) {
    this.client = client;
    this.apiKey = apiKey;
  }

  public RawConfig get(FetchKey key) throws FetchException {
    CompletableFuture<RawConfig> mine = new CompletableFuture<>();
    CompletableFuture<RawConfig> existing = entries.putIfAbsent(key, mine);
    if (existing != null) {
      log.debug("Adoption config for {} already requested, waiting for shared result", key);
      return await(existing, key);
    }

    fetchCount.incrementAndGet();
    try {
      RawConfig config = client.fetch(key.orgId(), key.siteId(), apiKey);
      mine.complete(config);
      return config;
    } catch (FetchException e) {
      fail(key, mine, e);
      throw e;
    } catch (RuntimeException e) {
      FetchException wrapped =
          new FetchException(
              FetchException.Reason.UNAVAILABLE,
              "Unexpected failure fetching adoption config for %s: %s".formatted(key, e),
              e);
      fail(key, mine, wrapped);
      throw wrapped;
    } finally {
      if (!mine.isDone()) {
        // an Error escaped; never leave waiters hanging
        fail(key, mine, new FetchException(FetchException.Reason.UNAVAILABLE, 0, "Fetch aborted"));
      }
    }
  }

  /** Number of remote fetches started so far. */
  public int fetchCount() {
    return fetchCount.get();
  }

  /** Number of keys with a cached or in-flight configuration. */
  public int size() {
    return entries.size();
  }

  private void fail(FetchKey key, CompletableFuture<RawConfig> future, FetchException cause) {
    // forget first, so a caller arriving after the failure retries instead of joining it
    entries.remove(key, future);
    future.completeExceptionally(cause);
  }

  private static RawConfig await(CompletableFuture<RawConfig> future, FetchKey key) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(
          FetchException.Reason.INTERRUPTED,
          "Interrupted while waiting for adoption config of " + key,
          e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof FetchException fe) {
        throw new FetchException(fe.getReason(), fe.getMessage(), fe);
      }
      throw new FetchException(
          FetchException.Reason.UNAVAILABLE,
          "Adoption config fetch for %s failed: %s".formatted(key, e.getCause()),
          e.getCause());
    }
  }
}
