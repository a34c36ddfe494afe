package eu.xfsc.cv.server.health;

import java.security.Security;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.apicatalog.jsonld.loader.DocumentLoader;

import eu.xfsc.cv.core.service.resolve.CachingDocumentLoader;
import eu.xfsc.cv.core.service.verification.VerifierSettings;

/**
 * Spring Boot health indicator for the credential verifier.
 * Reports the document cache, the local framing mode and whether the crypto provider is registered.
 */
@Component("credentialVerifierHealthIndicator")
public class VerifierHealthIndicator implements HealthIndicator {

  @Autowired
  private VerifierSettings settings;

  @Autowired
  private DocumentLoader documentLoader;

  @Override
  public Health health() {
    Health.Builder builder = Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null
        ? Health.down().withDetail("reason", "BouncyCastle security provider not registered")
        : Health.up();
    builder.withDetail("contextUrl", settings.getContextUrl());
    builder.withDetail("localFraming", settings.isDisableLocalFraming() ? "disabled" : "enabled");
    if (documentLoader instanceof CachingDocumentLoader) {
      builder.withDetail("documentCache", ((CachingDocumentLoader) documentLoader).size());
    } else {
      builder.withDetail("documentCache", "disabled");
    }
    return builder.build();
  }
}
