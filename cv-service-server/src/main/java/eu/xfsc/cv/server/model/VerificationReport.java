package eu.xfsc.cv.server.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import eu.xfsc.cv.core.exception.ServiceException;
import eu.xfsc.cv.core.pojo.VerificationParams;
import eu.xfsc.cv.core.pojo.VerificationResult;

/**
 * Wire form of a {@link VerificationResult}.
 *
 * @param verified overall outcome
 * @param tests evaluated checks by name, followed by {@code verified}
 * @param errors failure messages by stage
 * @param verifiedData the compacted claims, if compaction succeeded
 * @param expiration the credential expiration, if it has one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationReport(boolean verified, Map<String, Boolean> tests, Map<String, String> errors,
    JsonNode verifiedData, Instant expiration) {

  public static VerificationReport from(VerificationResult result, ObjectMapper objectMapper) {
    Map<String, String> errors = new LinkedHashMap<>();
    result.getErrors().forEach((stage, error) -> errors.put(stage.getKey(), describe(error)));
    VerificationParams params = result.getParams();
    JsonNode verifiedData = null;
    if (params.getVerifiedData() != null) {
      try {
        verifiedData = objectMapper.readTree(params.getVerifiedData().toString());
      } catch (JsonProcessingException ex) {
        throw new ServiceException("Verified data is not serializable: " + ex.getMessage(), ex);
      }
    }
    return new VerificationReport(result.isVerified(), result.getTests(), errors, verifiedData,
        params.isHasExpiration() ? params.getExpiration() : null);
  }

  private static String describe(Exception error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
