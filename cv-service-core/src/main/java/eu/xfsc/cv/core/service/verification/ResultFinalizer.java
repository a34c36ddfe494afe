package eu.xfsc.cv.core.service.verification;

import eu.xfsc.cv.core.pojo.VerificationParams;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.service.ld.LinkedDataCompactor;
import lombok.extern.slf4j.Slf4j;

/**
 * Compacts verified claims back to the credential context, dropping properties the context does not define.
 * Runs after the checks and never changes their outcome.
 */
@Slf4j
class ResultFinalizer {

  private final LinkedDataCompactor compactor;
  private final String contextUrl;

  ResultFinalizer(LinkedDataCompactor compactor, String contextUrl) {
    this.compactor = compactor;
    this.contextUrl = contextUrl;
  }

  void complete(VerificationResult result) {
    VerificationParams params = result.getParams();
    if (params.getData() == null) {
      return;
    }
    try {
      params.setVerifiedData(compactor.compact(params.getData(), contextUrl));
    } catch (RuntimeException ex) {
      log.info("complete.error; compaction failed: {}", ex.getMessage());
      result.addError(VerificationStage.COMPACT, ex);
    }
  }
}
