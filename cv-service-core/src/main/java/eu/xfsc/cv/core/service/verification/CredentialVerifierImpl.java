package eu.xfsc.cv.core.service.verification;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import eu.xfsc.cv.core.exception.ResolutionException;
import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.pojo.VerificationCheck;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.service.resolve.DocumentResolver;
import jakarta.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link CredentialVerifier}: assembles the parameters, evaluates the checks and
 * compacts the verified claims, in that order.
 */
@Slf4j
@Component
public class CredentialVerifierImpl implements CredentialVerifier {

  private final ParameterAssembler assembler;
  private final CheckAggregator aggregator;
  private final ResultFinalizer finalizer;
  private final Executor executor;

  @Autowired
  public CredentialVerifierImpl(VerifierSettings settings, @Qualifier("verificationExecutor") Executor executor) {
    DocumentResolver resolver = new DocumentResolver(settings.getDocumentLoader());
    FrameExtractor extractor = new FrameExtractor(resolver, settings.getFramer(),
        settings.isDisableLocalFraming(), settings.getLocalBaseUri());
    this.assembler = new ParameterAssembler(resolver, extractor, settings.getNormalizer(), settings.getContextUrl());
    this.aggregator = new CheckAggregator(new SignedDataBuilder(), new SignatureVerifier(settings.getCryptoProvider()),
        settings.getClock());
    this.finalizer = new ResultFinalizer(settings.getCompactor(), settings.getContextUrl());
    this.executor = executor;
    log.info("CredentialVerifierImpl; initialized with settings: {}", settings);
  }

  @Override
  public VerificationResult verifyCredential(String credentialUrl) {
    return verify(credentialUrl == null ? null : DocumentRef.ofUrl(credentialUrl));
  }

  @Override
  public VerificationResult verifyCredential(JsonObject credential) {
    return verify(credential == null ? null : DocumentRef.ofDocument(credential));
  }

  @Override
  public CompletableFuture<VerificationResult> verifyCredentialAsync(DocumentRef credential) {
    return CompletableFuture.supplyAsync(() -> verify(credential), executor);
  }

  VerificationResult verify(DocumentRef credential) {
    log.debug("verify.enter; credential: {}", credential);
    if (credential == null) {
      VerificationResult result = new VerificationResult();
      result.addError(VerificationStage.DATA, new ResolutionException("No credential given"));
      aggregator.aggregate(result);
      return result;
    }
    VerificationResult result = assembler.assemble(credential);
    aggregator.aggregate(result);
    if (result.getCheck(VerificationCheck.SIGNED).orElse(false)) {
      finalizer.complete(result);
    }
    log.debug("verify.exit; result: {}", result);
    return result;
  }
}
