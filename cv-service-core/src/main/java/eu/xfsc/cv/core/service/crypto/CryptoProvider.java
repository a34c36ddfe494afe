package eu.xfsc.cv.core.service.crypto;

import java.security.PublicKey;

import eu.xfsc.cv.core.exception.SignatureVerificationException;

/**
 * Cryptographic primitives used to check credential signatures.
 */
public interface CryptoProvider {

  /**
   * Parses a PEM encoded public key.
   *
   * @param pem the PEM text
   * @return the key
   * @throws SignatureVerificationException if the PEM does not hold a usable public key
   */
  PublicKey parsePublicKeyPem(String pem);

  /**
   * Verifies a signature over the SHA-256 digest of the given data.
   *
   * @param data the signed bytes
   * @param signature the raw signature value
   * @param key the signer's public key
   * @return {@code true} if the signature matches
   * @throws SignatureVerificationException if the signature cannot be checked at all
   */
  boolean verify(byte[] data, byte[] signature, PublicKey key);

}
