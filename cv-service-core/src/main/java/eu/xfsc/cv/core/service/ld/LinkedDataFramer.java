package eu.xfsc.cv.core.service.ld;

import eu.xfsc.cv.core.exception.FramingException;
import jakarta.json.JsonObject;

/**
 * JSON-LD framing capability.
 */
public interface LinkedDataFramer {

  /**
   * Frames the input document.
   *
   * @param input the document to frame
   * @param frame the frame, including its {@code @context}
   * @return the framed output; matches are either in {@code @graph} or, for a single match, at the top level
   * @throws FramingException if the processor fails
   */
  JsonObject frame(JsonObject input, JsonObject frame);

}
