package eu.xfsc.cv.core.service.verification;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

import eu.xfsc.cv.core.pojo.CredentialSignature;
import eu.xfsc.cv.core.pojo.VerificationCheck;
import eu.xfsc.cv.core.pojo.VerificationParams;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.util.JsonLdValues;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates the verification checks over assembled parameters.
 *
 * <p>Nothing beyond {@link VerificationCheck#SIGNED} is evaluated for an unsigned credential.
 * Checks whose inputs are missing are either recorded as failed or left out, see
 * {@link #aggregate(VerificationResult)}.</p>
 */
@Slf4j
class CheckAggregator {

  private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .appendLiteral('T')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .optionalEnd()
      .toFormatter();

  private final SignedDataBuilder signedDataBuilder;
  private final SignatureVerifier signatureVerifier;
  private final Clock clock;

  CheckAggregator(SignedDataBuilder signedDataBuilder, SignatureVerifier signatureVerifier, Clock clock) {
    this.signedDataBuilder = signedDataBuilder;
    this.signatureVerifier = signatureVerifier;
    this.clock = clock;
  }

  /**
   * Records the checks on the result. {@code publicKeyNotRevoked} needs the key,
   * {@code signatureVerified} a known signature type and {@code notExpired} the claims;
   * all other checks are recorded for every signed credential.
   *
   * @param result the assembled result, updated in place
   */
  void aggregate(VerificationResult result) {
    VerificationParams params = result.getParams();
    CredentialSignature signature = params.getSignature();
    result.setCheck(VerificationCheck.SIGNED, signature != null);
    if (signature == null) {
      return;
    }
    JsonObject publicKey = params.getPublicKey();
    result.setCheck(VerificationCheck.PUBLIC_KEY_ACCESSIBLE, publicKey != null);
    result.setCheck(VerificationCheck.PUBLIC_KEY_OWNER, isOwnedKey(params.getIdentity(), publicKey));
    result.setCheck(VerificationCheck.KNOWN_SIGNATURE_TYPE, signature.getType().isKnown());
    if (publicKey != null) {
      result.setCheck(VerificationCheck.PUBLIC_KEY_NOT_REVOKED, !publicKey.containsKey("revoked"));
    }
    if (signature.getType().isKnown()) {
      result.setCheck(VerificationCheck.SIGNATURE_VERIFIED, checkSignature(result));
    }
    if (params.getData() != null) {
      result.setCheck(VerificationCheck.NOT_EXPIRED, checkExpiration(result));
    }
    log.debug("aggregate.exit; checks: {}, verified: {}", result.getChecks(), result.isVerified());
  }

  private static boolean isOwnedKey(JsonObject identity, JsonObject publicKey) {
    if (identity == null || publicKey == null) {
      return false;
    }
    String keyId = JsonLdValues.getString(publicKey, "id");
    if (keyId == null) {
      return false;
    }
    return JsonLdValues.getValues(identity, "publicKey").stream()
        .map(JsonLdValues::getId)
        .anyMatch(keyId::equals);
  }

  private boolean checkSignature(VerificationResult result) {
    VerificationParams params = result.getParams();
    if (params.getPublicKey() == null || params.getNormalized() == null) {
      return false;
    }
    Optional<String> signedData = signedDataBuilder.build(params.getSignature(), params.getNormalized());
    if (signedData.isEmpty()) {
      return false;
    }
    params.setSignedData(signedData.get());
    return signatureVerifier.verify(JsonLdValues.getString(params.getPublicKey(), "publicKeyPem"),
        signedData.get(), params.getSignature().getSignatureValue(), result);
  }

  private boolean checkExpiration(VerificationResult result) {
    VerificationParams params = result.getParams();
    JsonValue expires = params.getData().get("expires");
    if (expires == null) {
      return true;
    }
    params.setHasExpiration(true);
    try {
      Instant expiration = parseExpiration(expires);
      params.setExpiration(expiration);
      return expiration.isAfter(clock.instant());
    } catch (DateTimeException ex) {
      log.info("checkExpiration.error; unparseable expires: {}", expires);
      result.addError(VerificationStage.EXPIRATION, ex);
      return false;
    }
  }

  static Instant parseExpiration(JsonValue expires) {
    if (expires.getValueType() == JsonValue.ValueType.NUMBER) {
      return Instant.ofEpochMilli(((JsonNumber) expires).longValue());
    }
    String value = JsonLdValues.lexical(expires);
    if (value == null) {
      throw new DateTimeParseException("expires is not a timestamp", String.valueOf(expires), 0);
    }
    TemporalAccessor parsed = TIMESTAMP.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
    if (parsed instanceof OffsetDateTime) {
      return ((OffsetDateTime) parsed).toInstant();
    }
    if (parsed instanceof LocalDateTime) {
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }
    return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
  }
}
