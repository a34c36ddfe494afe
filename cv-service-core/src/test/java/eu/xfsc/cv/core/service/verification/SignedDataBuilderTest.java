package eu.xfsc.cv.core.service.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import eu.xfsc.cv.core.pojo.CredentialSignature;
import jakarta.json.Json;
import jakarta.json.JsonObjectBuilder;

public class SignedDataBuilderTest {

  private static final String NQUADS = "<urn:a> <http://schema.org/name> \"x\" .\n";

  private final SignedDataBuilder builder = new SignedDataBuilder();

  private static JsonObjectBuilder signature(String type) {
    return Json.createObjectBuilder()
        .add("type", type)
        .add("creator", "https://issuer.example.com/keys/1")
        .add("signatureValue", "AAAA");
  }

  @Test
  public void graphSignature2012PrependsNonceAndCreated() {
    CredentialSignature signature = CredentialSignature.from(signature("GraphSignature2012")
        .add("created", "2015-01-01T00:00:00Z")
        .add("nonce", "abc")
        .build());

    assertEquals("abc2015-01-01T00:00:00Z" + NQUADS, builder.build(signature, NQUADS).orElseThrow());
  }

  @Test
  public void graphSignature2012WithoutNonce() {
    CredentialSignature signature = CredentialSignature.from(signature("GraphSignature2012")
        .add("created", "2015-01-01T00:00:00Z")
        .build());

    assertEquals("2015-01-01T00:00:00Z" + NQUADS, builder.build(signature, NQUADS).orElseThrow());
  }

  @Test
  public void linkedDataSignature2015WritesHeadersInOrder() {
    CredentialSignature signature = CredentialSignature.from(signature("LinkedDataSignature2015")
        .add("nonce", "n1")
        .add("domain", "example.com")
        .add("created", "2015-01-01T00:00:00Z")
        .build());

    String expected = "http://purl.org/dc/elements/1.1/created: 2015-01-01T00:00:00Z\n"
        + "https://w3id.org/security#domain: example.com\n"
        + "https://w3id.org/security#nonce: n1\n"
        + NQUADS;
    assertEquals(expected, builder.build(signature, NQUADS).orElseThrow());
  }

  @Test
  public void linkedDataSignature2015SkipsMissingHeaders() {
    CredentialSignature signature = CredentialSignature.from(signature("LinkedDataSignature2015")
        .add("created", "2015-01-01T00:00:00Z")
        .build());

    assertEquals("http://purl.org/dc/elements/1.1/created: 2015-01-01T00:00:00Z\n" + NQUADS,
        builder.build(signature, NQUADS).orElseThrow());
  }

  @Test
  public void unknownTypeHasNoSignedData() {
    CredentialSignature signature = CredentialSignature.from(signature("Ed25519Signature2020").build());

    assertTrue(builder.build(signature, NQUADS).isEmpty());
  }
}
