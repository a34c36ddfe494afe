package eu.xfsc.cv.core.service.ld;

import eu.xfsc.cv.core.exception.CompactionException;
import jakarta.json.JsonObject;

/**
 * JSON-LD compaction capability.
 */
public interface LinkedDataCompactor {

  /**
   * @param input the document to compact
   * @param contextUrl location of the context to compact against
   * @return the compacted document
   * @throws CompactionException if the processor fails
   */
  JsonObject compact(JsonObject input, String contextUrl);

}
