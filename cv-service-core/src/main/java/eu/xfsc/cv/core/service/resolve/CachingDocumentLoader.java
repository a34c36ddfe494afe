package eu.xfsc.cv.core.service.resolve;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.JsonLdErrorCode;
import com.apicatalog.jsonld.document.Document;
import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.jsonld.loader.DocumentLoaderOptions;

import lombok.extern.slf4j.Slf4j;

/**
 * Caches loaded documents (contexts, public keys, identities) per URL for a limited time.
 *
 * <p>At most one load per URL is in flight; concurrent callers for the same URL wait for
 * that load. Failed loads are not cached.</p>
 */
@Slf4j
public class CachingDocumentLoader implements DocumentLoader {

  private final DocumentLoader delegate;
  private final Duration ttl;
  private final int maxEntries;
  private final Clock clock;
  private final ConcurrentMap<URI, Entry> cache = new ConcurrentHashMap<>();

  public CachingDocumentLoader(DocumentLoader delegate, Duration ttl, int maxEntries, Clock clock) {
    this.delegate = delegate;
    this.ttl = ttl;
    this.maxEntries = maxEntries;
    this.clock = clock;
  }

  @Override
  public Document loadDocument(URI url, DocumentLoaderOptions options) throws JsonLdError {
    Instant now = clock.instant();
    CompletableFuture<Document> pending = new CompletableFuture<>();
    Entry entry = cache.compute(url, (key, existing) ->
        existing == null || existing.isExpired(now) ? new Entry(pending, now.plus(ttl)) : existing);

    if (entry.document == pending) {
      log.debug("loadDocument; cache miss for {}", url);
      try {
        pending.complete(delegate.loadDocument(url, options));
      } catch (Throwable ex) {
        // waiters and later callers must not see a load that never completes
        cache.remove(url, entry);
        pending.completeExceptionally(ex);
        throw ex;
      }
      evictIfFull(now);
    }
    return await(url, entry.document);
  }

  public int size() {
    return cache.size();
  }

  public void clear() {
    cache.clear();
  }

  private void evictIfFull(Instant now) {
    if (cache.size() <= maxEntries) {
      return;
    }
    cache.entrySet().removeIf(e -> e.getValue().isExpired(now) || e.getValue().document.isCompletedExceptionally());
    if (cache.size() > maxEntries) {
      log.debug("evictIfFull; {} entries above limit {}, clearing cache", cache.size(), maxEntries);
      cache.entrySet().removeIf(e -> e.getValue().document.isDone());
    }
  }

  private static Document await(URI url, CompletableFuture<Document> document) throws JsonLdError {
    try {
      return document.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof JsonLdError) {
        throw (JsonLdError) cause;
      }
      throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "Loading " + url + " failed: " + cause);
    }
  }

  private static final class Entry {

    private final CompletableFuture<Document> document;
    private final Instant expiresAt;

    private Entry(CompletableFuture<Document> document, Instant expiresAt) {
      this.document = document;
      this.expiresAt = expiresAt;
    }

    private boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
