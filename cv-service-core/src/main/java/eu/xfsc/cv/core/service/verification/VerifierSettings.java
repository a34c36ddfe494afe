package eu.xfsc.cv.core.service.verification;

import java.time.Clock;

import com.apicatalog.jsonld.loader.DocumentLoader;

import eu.xfsc.cv.core.service.crypto.CryptoProvider;
import eu.xfsc.cv.core.service.ld.LinkedDataCompactor;
import eu.xfsc.cv.core.service.ld.LinkedDataFramer;
import eu.xfsc.cv.core.service.ld.LinkedDataNormalizer;

/**
 * Collaborators and options of a {@link CredentialVerifier}.
 * Built by {@link eu.xfsc.cv.core.config.CoreConfig} from configuration, or by hand when used as a library.
 */
@lombok.Getter
@lombok.Builder(toBuilder = true)
@lombok.ToString(onlyExplicitlyIncluded = true)
public class VerifierSettings {

  public static final String CREDENTIALS_CONTEXT_URL = "https://w3id.org/credentials/v1";
  public static final String OPEN_BADGES_CONTEXT_URL = "https://w3id.org/openbadges/v1";

  @lombok.NonNull
  private final DocumentLoader documentLoader;
  @lombok.NonNull
  private final LinkedDataFramer framer;
  @lombok.NonNull
  private final LinkedDataNormalizer normalizer;
  @lombok.NonNull
  private final LinkedDataCompactor compactor;
  @lombok.NonNull
  private final CryptoProvider cryptoProvider;

  /** Skip framing of documents living under {@link #localBaseUri}. */
  @lombok.ToString.Include
  private final boolean disableLocalFraming;
  @lombok.ToString.Include
  private final String localBaseUri;
  @lombok.ToString.Include
  @lombok.Builder.Default
  private final String contextUrl = CREDENTIALS_CONTEXT_URL;
  @lombok.Builder.Default
  private final Clock clock = Clock.systemUTC();

}
