package eu.xfsc.cv.core.service.ld;

import com.apicatalog.jsonld.JsonLd;
import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.loader.DocumentLoader;

import eu.xfsc.cv.core.exception.FramingException;
import jakarta.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LinkedDataFramer} backed by the Titanium JSON-LD processor.
 */
@Slf4j
public class TitaniumFramer implements LinkedDataFramer {

  private final DocumentLoader documentLoader;

  public TitaniumFramer(DocumentLoader documentLoader) {
    this.documentLoader = documentLoader;
  }

  @Override
  public JsonObject frame(JsonObject input, JsonObject frame) {
    try {
      return JsonLd.frame(JsonDocument.of(input), JsonDocument.of(frame))
          .loader(documentLoader)
          .get();
    } catch (JsonLdError ex) {
      log.debug("frame.error; code: {}, message: {}", ex.getCode(), ex.getMessage());
      throw new FramingException("Framing failed: " + ex.getMessage(), ex);
    }
  }
}
