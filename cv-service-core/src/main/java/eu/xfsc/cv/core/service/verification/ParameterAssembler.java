package eu.xfsc.cv.core.service.verification;

import java.util.ArrayList;
import java.util.List;

import eu.xfsc.cv.core.exception.FramingException;
import eu.xfsc.cv.core.exception.ResolutionException;
import eu.xfsc.cv.core.pojo.CredentialSignature;
import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.pojo.VerificationParams;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.service.ld.LinkedDataNormalizer;
import eu.xfsc.cv.core.service.resolve.DocumentResolver;
import eu.xfsc.cv.core.util.JsonLdValues;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Gathers the verification parameters of a credential across three hops:
 * credential, signer's public key, identity owning that key.
 *
 * <p>Failing to frame the credential or to normalize its claims ends the assembly; a missing
 * public key or identity is recorded and assembly goes on with what is available.</p>
 */
@Slf4j
class ParameterAssembler {

  private final DocumentResolver resolver;
  private final FrameExtractor extractor;
  private final LinkedDataNormalizer normalizer;
  private final JsonObject signedObjectFrame;
  private final JsonObject publicKeyFrame;
  private final List<JsonObject> identityFrames;

  ParameterAssembler(DocumentResolver resolver, FrameExtractor extractor, LinkedDataNormalizer normalizer, String contextUrl) {
    this.resolver = resolver;
    this.extractor = extractor;
    this.normalizer = normalizer;
    this.signedObjectFrame = Frames.signedObject(contextUrl);
    this.publicKeyFrame = Frames.publicKey(contextUrl);
    this.identityFrames = Frames.identities(contextUrl);
  }

  /**
   * @param credential the credential, inline or by URL
   * @return a result holding the gathered parameters and any failures, never {@code null}
   */
  VerificationResult assemble(DocumentRef credential) {
    log.debug("assemble.enter; credential: {}", credential);
    VerificationResult result = new VerificationResult();
    VerificationParams params = result.getParams();

    JsonObject framed;
    try {
      framed = extractor.extract(credential, signedObjectFrame);
    } catch (RuntimeException ex) {
      log.info("assemble.error; credential not framed: {}", ex.getMessage());
      result.addError(VerificationStage.DATA, ex);
      return result;
    }

    JsonObject signatureNode = JsonLdValues.getObject(framed, "signature");
    params.setData(Json.createObjectBuilder(framed).remove("signature").build());
    if (signatureNode == null) {
      log.debug("assemble.exit; credential carries no signature");
      return result;
    }
    CredentialSignature signature = CredentialSignature.from(signatureNode);
    params.setSignature(signature);

    JsonObject publicKey = fetchPublicKey(signature, result);
    if (publicKey != null) {
      params.setPublicKey(publicKey);
      fetchIdentity(publicKey, result);
    }

    try {
      params.setNormalized(normalizer.normalize(params.getData(), signature.getType().getAlgorithm()));
    } catch (RuntimeException ex) {
      log.info("assemble.error; normalization failed: {}", ex.getMessage());
      result.addError(VerificationStage.NORMALIZATION, ex);
      return result;
    }
    log.debug("assemble.exit; params: {}", params);
    return result;
  }

  private JsonObject fetchPublicKey(CredentialSignature signature, VerificationResult result) {
    try {
      if (signature.getCreator() == null) {
        throw new ResolutionException("Signature has no creator");
      }
      return extractor.extract(DocumentRef.ofUrl(signature.getCreator()), publicKeyFrame);
    } catch (RuntimeException ex) {
      log.info("fetchPublicKey.error; creator: {}, error: {}", signature.getCreator(), ex.getMessage());
      result.addError(VerificationStage.PUBLIC_KEY, ex);
      return null;
    }
  }

  private void fetchIdentity(JsonObject publicKey, VerificationResult result) {
    String owner = JsonLdValues.getId(publicKey.get("owner"));
    try {
      if (owner == null) {
        throw new ResolutionException("Public key has no owner");
      }
      JsonObject identity = resolver.resolve(owner);
      result.getParams().setIdentity(frameIdentity(identity));
    } catch (RuntimeException ex) {
      log.info("fetchIdentity.error; owner: {}, error: {}", owner, ex.getMessage());
      result.addError(VerificationStage.PUBLIC_KEY_OWNER, ex);
    }
  }

  private JsonObject frameIdentity(JsonObject identity) {
    List<RuntimeException> failures = new ArrayList<>(identityFrames.size());
    for (JsonObject frame : identityFrames) {
      try {
        return extractor.extract(DocumentRef.ofDocument(identity), frame);
      } catch (RuntimeException ex) {
        log.debug("frameIdentity; shape {} not matched: {}", frame.get("@context"), ex.getMessage());
        failures.add(ex);
      }
    }
    FramingException error = new FramingException("Identity matches none of the known identity shapes");
    failures.forEach(error::addSuppressed);
    throw error;
  }
}
