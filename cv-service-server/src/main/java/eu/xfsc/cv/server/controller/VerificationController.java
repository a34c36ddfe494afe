package eu.xfsc.cv.server.controller;

import java.io.StringReader;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.xfsc.cv.core.exception.ClientException;
import eu.xfsc.cv.core.pojo.VerificationResult;
import eu.xfsc.cv.core.service.verification.CredentialVerifier;
import eu.xfsc.cv.server.model.VerificationReport;
import jakarta.json.Json;
import jakarta.json.JsonException;
import jakarta.json.JsonReader;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * REST endpoints verifying credentials given inline or by URL.
 * A verification always answers 200; the report tells whether the credential verified.
 */
@Slf4j
@RestController
@RequestMapping("/verifications")
public class VerificationController {

  static final String JSON_LD_VALUE = "application/ld+json";

  @Autowired
  private CredentialVerifier credentialVerifier;

  @Autowired
  private ObjectMapper objectMapper;

  /**
   * Verifies the credential posted in the request body.
   *
   * @param body JSON-LD credential
   * @return 200 OK with the verification report, 400 if the body is not a JSON object
   */
  @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, JSON_LD_VALUE}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<VerificationReport> verifyCredential(@RequestBody String body) {
    log.debug("verifyCredential.enter; body length: {}", body.length());
    VerificationResult result = credentialVerifier.verifyCredential(parseCredential(body).asJsonObject());
    log.debug("verifyCredential.exit; verified: {}", result.isVerified());
    return ResponseEntity.ok(VerificationReport.from(result, objectMapper));
  }

  /**
   * Verifies the credential published at the given URL.
   *
   * @param url credential location
   * @return 200 OK with the verification report
   */
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<VerificationReport> verifyCredentialByUrl(@RequestParam("url") String url) {
    log.debug("verifyCredentialByUrl.enter; url: {}", url);
    VerificationResult result = credentialVerifier.verifyCredential(url);
    log.debug("verifyCredentialByUrl.exit; verified: {}", result.isVerified());
    return ResponseEntity.ok(VerificationReport.from(result, objectMapper));
  }

  private static JsonValue parseCredential(String body) {
    JsonValue value;
    try (JsonReader reader = Json.createReader(new StringReader(body))) {
      value = reader.readValue();
    } catch (JsonException ex) {
      throw new ClientException("Credential is not valid JSON: " + ex.getMessage(), ex);
    }
    if (value.getValueType() != JsonValue.ValueType.OBJECT) {
      throw new ClientException("Credential must be a JSON object, got " + value.getValueType());
    }
    return value;
  }
}
