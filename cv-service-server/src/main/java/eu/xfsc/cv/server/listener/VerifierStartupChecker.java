package eu.xfsc.cv.server.listener;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import eu.xfsc.cv.core.config.DocumentLoaderProperties;
import eu.xfsc.cv.core.service.verification.VerifierSettings;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the effective verifier configuration at application startup and flags risky settings.
 */
@Slf4j
@Component
public class VerifierStartupChecker implements ApplicationListener<ApplicationReadyEvent> {

  @Autowired
  private VerifierSettings settings;

  @Autowired
  private DocumentLoaderProperties loaderProperties;

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info("Credential verifier ready: {}", settings);
    log.info("Document loading: {}", loaderProperties);
    if (settings.isDisableLocalFraming()
        && (settings.getLocalBaseUri() == null || settings.getLocalBaseUri().isBlank())) {
      log.warn("Local framing is disabled but no local base URI is set; all documents will be framed");
    }
    if (!loaderProperties.isSecure()) {
      log.warn("Documents may be loaded over plain http");
    }
  }
}
