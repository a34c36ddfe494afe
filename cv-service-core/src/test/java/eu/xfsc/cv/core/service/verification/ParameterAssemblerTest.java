package eu.xfsc.cv.core.service.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import eu.xfsc.cv.core.exception.FramingException;
import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.pojo.SignatureType;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.pojo.VerificationStage;
import eu.xfsc.cv.core.service.ld.LinkedDataFramer;
import eu.xfsc.cv.core.service.resolve.DocumentResolver;
import eu.xfsc.cv.core.service.resolve.InMemoryDocumentLoader;
import eu.xfsc.cv.core.util.TestUtil;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

public class ParameterAssemblerTest {

  private static final String KEY_URL = "https://issuer.example.com/keys/1";
  private static final String IDENTITY_URL = "https://issuer.example.com/i/issuer";
  private static final String CTX = VerifierSettings.CREDENTIALS_CONTEXT_URL;
  private static final String OB_CTX = VerifierSettings.OPEN_BADGES_CONTEXT_URL;

  private InMemoryDocumentLoader loader;
  private List<JsonObject> frames;
  private List<String> normalizedWith;

  @BeforeEach
  public void setUp() {
    loader = new InMemoryDocumentLoader()
        .put(KEY_URL, Json.createObjectBuilder(TestUtil.getJson("fixtures/public-key.json"))
            .add("publicKeyPem", TestUtil.publicKeyPem())
            .build())
        .put(IDENTITY_URL, TestUtil.getJson("fixtures/identity.json"));
    frames = new ArrayList<>();
    normalizedWith = new ArrayList<>();
  }

  private ParameterAssembler assembler(LinkedDataFramer framer) {
    DocumentResolver resolver = new DocumentResolver(loader);
    LinkedDataFramer recording = (input, frame) -> {
      frames.add(frame);
      return framer.frame(input, frame);
    };
    return new ParameterAssembler(resolver, new FrameExtractor(resolver, recording, false, null),
        (doc, algorithm) -> {
          normalizedWith.add(algorithm.name());
          return "nquads";
        }, CTX);
  }

  /** Frames by returning the input itself as the single match. */
  private static JsonObject identityFraming(JsonObject input, JsonObject frame) {
    return Json.createObjectBuilder().add("@graph", Json.createArrayBuilder().add(input)).build();
  }

  private static String frameContext(JsonObject frame) {
    return frame.getJsonArray("@context").getString(0);
  }

  private static boolean isIdentityFrame(JsonObject frame) {
    return "Identity".equals(frame.getString("type", null));
  }

  private static JsonObject credential() {
    return Json.createObjectBuilder(TestUtil.getJson("fixtures/credential-claims.json"))
        .add("signature", Json.createObjectBuilder()
            .add("type", "LinkedDataSignature2015")
            .add("creator", KEY_URL)
            .add("created", "2025-06-01T10:00:00Z")
            .add("signatureValue", "AAAA"))
        .build();
  }

  @Test
  public void framesWithNullBase() {
    VerificationResult result = assembler(ParameterAssemblerTest::identityFraming)
        .assemble(DocumentRef.ofDocument(credential()));

    assertTrue(result.getErrors().isEmpty(), result.getErrors().toString());
    assertEquals(3, frames.size());
    for (JsonObject frame : frames) {
      assertEquals(JsonValue.NULL, frame.getJsonArray("@context").getJsonObject(1).get("@base"));
    }
    assertEquals("CryptographicKey", frames.get(1).getString("type"));
    assertEquals(CTX, result.getParams().getData().getString("@context"));
    assertFalse(result.getParams().getData().containsKey("signature"));
    assertEquals(SignatureType.LINKED_DATA_SIGNATURE_2015, result.getParams().getSignature().getType());
    assertEquals(List.of("URDNA2015"), normalizedWith);
    assertEquals("nquads", result.getParams().getNormalized());
  }

  @Test
  public void identityFallsBackToOpenBadgesShape() {
    VerificationResult result = assembler((input, frame) -> {
      if (isIdentityFrame(frame) && CTX.equals(frameContext(frame))) {
        return Json.createObjectBuilder().add("@graph", Json.createArrayBuilder()).build();
      }
      return identityFraming(input, frame);
    }).assemble(DocumentRef.ofDocument(credential()));

    assertTrue(result.getError(VerificationStage.PUBLIC_KEY_OWNER).isEmpty());
    assertNotNull(result.getParams().getIdentity());
    assertEquals(OB_CTX, result.getParams().getIdentity().getString("@context"));
  }

  @Test
  public void identityMatchingNoShapeIsRecorded() {
    VerificationResult result = assembler((input, frame) -> {
      if (isIdentityFrame(frame)) {
        throw new FramingException("unknown shape for " + frameContext(frame));
      }
      return identityFraming(input, frame);
    }).assemble(DocumentRef.ofDocument(credential()));

    Exception error = result.getError(VerificationStage.PUBLIC_KEY_OWNER).orElseThrow();
    assertEquals(2, error.getSuppressed().length);
    assertNull(result.getParams().getIdentity());
    assertNotNull(result.getParams().getPublicKey());
    assertEquals("nquads", result.getParams().getNormalized());
  }

  @Test
  public void keyWithoutMatchSkipsIdentity() {
    VerificationResult result = assembler((input, frame) -> {
      if ("CryptographicKey".equals(frame.getString("type", null))) {
        return Json.createObjectBuilder().add("@context", CTX).build();
      }
      return identityFraming(input, frame);
    }).assemble(DocumentRef.ofDocument(credential()));

    Exception error = result.getError(VerificationStage.PUBLIC_KEY).orElseThrow();
    assertTrue(error instanceof FramingException);
    assertNull(result.getParams().getPublicKey());
    assertEquals(0, loader.loadCount(IDENTITY_URL));
    assertEquals("nquads", result.getParams().getNormalized());
  }

  @Test
  public void missingCreatorIsRecorded() {
    JsonObject credential = Json.createObjectBuilder(credential())
        .add("signature", Json.createObjectBuilder().add("type", "GraphSignature2012").add("signatureValue", "AAAA"))
        .build();

    VerificationResult result = assembler(ParameterAssemblerTest::identityFraming)
        .assemble(DocumentRef.ofDocument(credential));

    assertTrue(result.getError(VerificationStage.PUBLIC_KEY).isPresent());
    assertEquals(List.of("URGNA2012"), normalizedWith);
  }

  @Test
  public void unframeableCredentialEndsAssembly() {
    VerificationResult result = assembler((input, frame) -> Json.createObjectBuilder().add("@graph", Json.createArrayBuilder()).build())
        .assemble(DocumentRef.ofDocument(credential()));

    Exception error = result.getError(VerificationStage.DATA).orElseThrow();
    assertEquals("No matching object found for frame.", error.getMessage());
    assertNull(result.getParams().getData());
    assertNull(result.getParams().getSignature());
    assertTrue(normalizedWith.isEmpty());
  }
}
