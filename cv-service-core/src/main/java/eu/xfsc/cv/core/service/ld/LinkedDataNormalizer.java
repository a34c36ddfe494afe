package eu.xfsc.cv.core.service.ld;

import eu.xfsc.cv.core.exception.NormalizationException;
import eu.xfsc.cv.core.pojo.CanonicalizationAlgorithm;
import jakarta.json.JsonObject;

/**
 * Canonicalization of a JSON-LD document into N-Quads.
 */
public interface LinkedDataNormalizer {

  /**
   * Converts the document to RDF and serializes its canonical form.
   *
   * @param input the document to normalize
   * @param algorithm the canonicalization algorithm, {@link CanonicalizationAlgorithm#DEFAULT} for the implementation default
   * @return canonical N-Quads
   * @throws NormalizationException if conversion or canonicalization fails
   */
  String normalize(JsonObject input, CanonicalizationAlgorithm algorithm);

}
