package eu.xfsc.cv.core.service.resolve;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Map;

import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.JsonLdErrorCode;
import com.apicatalog.jsonld.document.Document;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.http.media.MediaType;
import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.jsonld.loader.DocumentLoaderOptions;

import lombok.extern.slf4j.Slf4j;

/**
 * Serves well-known documents, typically JSON-LD contexts, from the classpath and
 * delegates every other URL.
 */
@Slf4j
public class StaticContextLoader implements DocumentLoader {

  private final Map<String, String> resources;
  private final DocumentLoader delegate;
  private final ClassLoader classLoader;

  /**
   * @param resources document URL to classpath resource path
   * @param delegate loader for URLs without a static mapping
   */
  public StaticContextLoader(Map<String, String> resources, DocumentLoader delegate) {
    this.resources = Map.copyOf(resources);
    this.delegate = delegate;
    this.classLoader = StaticContextLoader.class.getClassLoader();
  }

  @Override
  public Document loadDocument(URI url, DocumentLoaderOptions options) throws JsonLdError {
    String resource = resources.get(url.toString());
    if (resource == null) {
      return delegate.loadDocument(url, options);
    }
    log.debug("loadDocument; serving {} from classpath:{}", url, resource);
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, "Missing classpath resource " + resource + " for " + url);
      }
      Document document = JsonDocument.of(MediaType.JSON_LD, is);
      document.setDocumentUrl(url);
      return document;
    } catch (IOException ex) {
      throw new JsonLdError(JsonLdErrorCode.LOADING_DOCUMENT_FAILED, ex);
    }
  }
}
