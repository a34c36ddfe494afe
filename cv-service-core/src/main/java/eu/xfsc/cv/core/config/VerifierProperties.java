package eu.xfsc.cv.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import eu.xfsc.cv.core.service.verification.VerifierSettings;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Verification options, bound from {@code credential-verifier.*}.
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "credential-verifier")
public class VerifierProperties {

  /** Context the verified claims are compacted against, also used by the credential and key frames. */
  private String contextUrl = VerifierSettings.CREDENTIALS_CONTEXT_URL;
  private boolean disableLocalFraming = false;
  private String localBaseUri;
  /** Threads serving asynchronous verifications. */
  private int asyncThreads = 4;

}
