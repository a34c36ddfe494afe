package eu.xfsc.cv.core.service.verification;

import eu.xfsc.cv.core.exception.FramingException;
import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.service.ld.LinkedDataFramer;
import eu.xfsc.cv.core.service.resolve.DocumentResolver;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts the first object of a document that matches a frame.
 *
 * <p>Framing always happens against a {@code null} base so results do not depend on where the
 * document was fetched from. When local framing is disabled, documents under the local base
 * URI are trusted to be in the expected shape and returned unframed.</p>
 */
@Slf4j
class FrameExtractor {

  private final DocumentResolver resolver;
  private final LinkedDataFramer framer;
  private final boolean disableLocalFraming;
  private final String localBaseUri;

  FrameExtractor(DocumentResolver resolver, LinkedDataFramer framer, boolean disableLocalFraming, String localBaseUri) {
    this.resolver = resolver;
    this.framer = framer;
    this.disableLocalFraming = disableLocalFraming;
    this.localBaseUri = localBaseUri;
  }

  /**
   * @param ref the document, inline or by URL
   * @param frame the frame to match
   * @return the first match, carrying the frame's plain {@code @context}
   * @throws FramingException if nothing matches
   * @throws eu.xfsc.cv.core.exception.ResolutionException if the document cannot be loaded
   */
  JsonObject extract(DocumentRef ref, JsonObject frame) {
    JsonObject input = resolver.resolve(ref);
    if (isLocal(ref)) {
      log.debug("extract; skipping framing of local document {}", ref);
      return input;
    }
    JsonValue context = frame.get("@context");
    JsonObject baseless = Json.createObjectBuilder(frame)
        .add("@context", Json.createArrayBuilder()
            .add(context)
            .add(Json.createObjectBuilder().addNull("@base")))
        .build();
    JsonObject match = firstMatch(framer.frame(input, baseless));
    if (match == null) {
      throw new FramingException("No matching object found for frame.");
    }
    return Json.createObjectBuilder(match).add("@context", context).build();
  }

  private boolean isLocal(DocumentRef ref) {
    if (!disableLocalFraming || localBaseUri == null || localBaseUri.isEmpty()) {
      return false;
    }
    String location = ref.getLocation();
    return location != null && location.startsWith(localBaseUri);
  }

  private static JsonObject firstMatch(JsonObject framed) {
    if (framed == null) {
      return null;
    }
    JsonValue graph = framed.get("@graph");
    if (graph != null) {
      if (graph.getValueType() == JsonValue.ValueType.ARRAY) {
        JsonArray matches = graph.asJsonArray();
        if (matches.isEmpty() || matches.get(0).getValueType() != JsonValue.ValueType.OBJECT) {
          return null;
        }
        return matches.get(0).asJsonObject();
      }
      return graph.getValueType() == JsonValue.ValueType.OBJECT ? graph.asJsonObject() : null;
    }
    JsonObject node = Json.createObjectBuilder(framed).remove("@context").build();
    return node.isEmpty() ? null : node;
  }
}
