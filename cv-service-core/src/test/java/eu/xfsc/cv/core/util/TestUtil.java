package eu.xfsc.cv.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Base64;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;

public final class TestUtil {

  private static final KeyPair KEY_PAIR = generateKeyPair();

  private TestUtil() {
  }

  public static JsonObject getJson(String path) {
    try (InputStream is = TestUtil.class.getClassLoader().getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalArgumentException("missing test resource " + path);
      }
      try (JsonReader reader = Json.createReader(is)) {
        return reader.readObject();
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static String publicKeyPem() {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
        .encodeToString(KEY_PAIR.getPublic().getEncoded());
    return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
  }

  public static KeyPair keyPair() {
    return KEY_PAIR;
  }

  public static String sign(String data) {
    try {
      Signature signer = Signature.getInstance("SHA256withRSA");
      signer.initSign(KEY_PAIR.getPrivate());
      signer.update(data.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signer.sign());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException(ex);
    }
  }

  /** Flips one bit of the first byte of a base64 value. */
  public static String corrupt(String base64) {
    byte[] raw = Base64.getDecoder().decode(base64);
    raw[0] ^= 0x01;
    return Base64.getEncoder().encodeToString(raw);
  }

  private static KeyPair generateKeyPair() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(2048);
      return generator.generateKeyPair();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
