package eu.xfsc.cv.core.service.resolve;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.JsonLdErrorCode;
import com.apicatalog.jsonld.document.Document;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.http.media.MediaType;
import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.jsonld.loader.DocumentLoaderOptions;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads JSON-LD documents over HTTP(S).
 *
 * <p>Every exchange, body included, is bounded by the request timeout. Redirects are followed
 * up to {@link #MAX_REDIRECTS} hops; in secure mode a redirect may not leave https.</p>
 */
@Slf4j
public class HttpDocumentLoader implements DocumentLoader {

  public static final int MAX_REDIRECTS = 10;

  private static final String ACCEPT = "application/ld+json, application/json;q=0.9, */*;q=0.1";

  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final boolean secure;

  /**
   * @param httpClient client to send requests with, expected not to follow redirects itself
   * @param requestTimeout upper bound for one request/response exchange
   * @param secure refuse any URL that is not https
   */
  public HttpDocumentLoader(HttpClient httpClient, Duration requestTimeout, boolean secure) {
    this.httpClient = httpClient;
    this.requestTimeout = requestTimeout;
    this.secure = secure;
  }

  @Override
  public Document loadDocument(URI url, DocumentLoaderOptions options) throws JsonLdError {
    URI target = url;
    for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
      checkScheme(target);
      HttpResponse<byte[]> response = send(target);
      int status = response.statusCode();
      if (status >= 300 && status < 400) {
        Optional<String> location = response.headers().firstValue("Location");
        if (location.isEmpty()) {
          throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED,
              "Redirect without Location from " + target + ", status " + status);
        }
        log.debug("loadDocument; {} redirected to {}", target, location.get());
        target = target.resolve(location.get());
        continue;
      }
      if (status != 200) {
        throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "Loading " + target + " failed, status " + status);
      }
      try (InputStream body = new ByteArrayInputStream(response.body())) {
        Document document = JsonDocument.of(MediaType.JSON_LD, body);
        document.setDocumentUrl(target);
        return document;
      } catch (IOException ex) {
        throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, ex);
      }
    }
    throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "Too many redirects loading " + url);
  }

  private void checkScheme(URI target) throws JsonLdError {
    String scheme = target.getScheme();
    boolean allowed = "https".equalsIgnoreCase(scheme) || (!secure && "http".equalsIgnoreCase(scheme));
    if (!allowed) {
      throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "URL scheme not allowed: " + target);
    }
  }

  private HttpResponse<byte[]> send(URI target) throws JsonLdError {
    HttpRequest request = HttpRequest.newBuilder(target)
        .GET()
        .header("Accept", ACCEPT)
        .timeout(requestTimeout)
        .build();
    CompletableFuture<HttpResponse<byte[]>> pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    try {
      return pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      pending.cancel(true);
      throw timedOut(target);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof HttpTimeoutException) {
        throw timedOut(target);
      }
      throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, ex.getCause());
    } catch (InterruptedException ex) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, ex);
    }
  }

  private JsonLdError timedOut(URI target) {
    log.info("send; {} timed out after {}", target, requestTimeout);
    return new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "Loading " + target + " timed out after " + requestTimeout);
  }
}
