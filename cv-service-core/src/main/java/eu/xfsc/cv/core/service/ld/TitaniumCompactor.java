package eu.xfsc.cv.core.service.ld;

import com.apicatalog.jsonld.JsonLd;
import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.loader.DocumentLoader;

import eu.xfsc.cv.core.exception.CompactionException;
import jakarta.json.JsonObject;

/**
 * {@link LinkedDataCompactor} backed by the Titanium JSON-LD processor.
 */
public class TitaniumCompactor implements LinkedDataCompactor {

  private final DocumentLoader documentLoader;

  public TitaniumCompactor(DocumentLoader documentLoader) {
    this.documentLoader = documentLoader;
  }

  @Override
  public JsonObject compact(JsonObject input, String contextUrl) {
    try {
      return JsonLd.compact(JsonDocument.of(input), contextUrl)
          .loader(documentLoader)
          .get();
    } catch (JsonLdError ex) {
      throw new CompactionException("Compaction against " + contextUrl + " failed: " + ex.getMessage(), ex);
    }
  }
}
