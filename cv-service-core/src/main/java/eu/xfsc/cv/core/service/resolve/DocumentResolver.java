package eu.xfsc.cv.core.service.resolve;

import java.net.URI;
import java.util.Optional;

import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.document.Document;
import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.jsonld.loader.DocumentLoaderOptions;

import eu.xfsc.cv.core.exception.ResolutionException;
import eu.xfsc.cv.core.pojo.DocumentRef;
import jakarta.json.JsonObject;
import jakarta.json.JsonStructure;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches documents referenced by value or by URL through the configured {@link DocumentLoader}.
 */
@Slf4j
public class DocumentResolver {

  private final DocumentLoader documentLoader;

  public DocumentResolver(DocumentLoader documentLoader) {
    this.documentLoader = documentLoader;
  }

  /**
   * Returns the referenced document as a JSON object.
   *
   * @param ref inline document or URL
   * @return the document
   * @throws ResolutionException if the URL is malformed, loading fails or the body is not a JSON object
   */
  public JsonObject resolve(DocumentRef ref) {
    if (ref.isInline()) {
      return ref.getDocument();
    }
    return resolve(ref.getUrl());
  }

  /**
   * Loads the document at the given URL.
   *
   * @param url the document location
   * @return the document
   * @throws ResolutionException if the URL is malformed, loading fails or the body is not a JSON object
   */
  public JsonObject resolve(String url) {
    log.debug("resolve.enter; url: {}", url);
    if (url == null || url.isBlank()) {
      throw new ResolutionException("No document URL given");
    }
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException ex) {
      throw new ResolutionException("Malformed document URL: " + url, ex);
    }
    Document document;
    try {
      document = documentLoader.loadDocument(uri, new DocumentLoaderOptions());
    } catch (JsonLdError ex) {
      throw new ResolutionException("Failed to load " + url + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      throw new ResolutionException("No document returned for " + url);
    }
    Optional<JsonStructure> content = document.getJsonContent();
    if (content.isEmpty()) {
      throw new ResolutionException("Document at " + url + " has no JSON content");
    }
    JsonObject result = toObject(content.get(), url);
    log.debug("resolve.exit; loaded document with {} properties", result.size());
    return result;
  }

  private static JsonObject toObject(JsonStructure content, String url) {
    if (content.getValueType() != JsonValue.ValueType.OBJECT) {
      throw new ResolutionException("Document at " + url + " is not a JSON object");
    }
    return content.asJsonObject();
  }
}
