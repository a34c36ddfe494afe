package eu.xfsc.cv.core.service.crypto;

import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Security;
import java.security.Signature;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import eu.xfsc.cv.core.exception.SignatureVerificationException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link CryptoProvider} for RSA keys: PEM parsing and RSASSA-PKCS1-v1_5 with SHA-256,
 * both through the BouncyCastle provider.
 */
@Slf4j
public class BouncyCastleCryptoProvider implements CryptoProvider {

  static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

  public BouncyCastleCryptoProvider() {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      log.debug("registering BouncyCastle security provider");
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  @Override
  public PublicKey parsePublicKeyPem(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new SignatureVerificationException("Public key has no PEM encoding");
    }
    Object parsed;
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      parsed = parser.readObject();
    } catch (IOException ex) {
      throw new SignatureVerificationException("Unreadable public key PEM: " + ex.getMessage(), ex);
    }
    SubjectPublicKeyInfo keyInfo;
    if (parsed instanceof SubjectPublicKeyInfo) {
      keyInfo = (SubjectPublicKeyInfo) parsed;
    } else if (parsed instanceof X509CertificateHolder) {
      keyInfo = ((X509CertificateHolder) parsed).getSubjectPublicKeyInfo();
    } else {
      throw new SignatureVerificationException("PEM does not contain a public key"
          + (parsed == null ? "" : ", found " + parsed.getClass().getSimpleName()));
    }
    try {
      PublicKey key = new JcaPEMKeyConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME).getPublicKey(keyInfo);
      if (!"RSA".equals(key.getAlgorithm())) {
        throw new SignatureVerificationException("Unsupported public key algorithm: " + key.getAlgorithm());
      }
      return key;
    } catch (IOException ex) {
      throw new SignatureVerificationException("Invalid public key: " + ex.getMessage(), ex);
    }
  }

  @Override
  public boolean verify(byte[] data, byte[] signature, PublicKey key) {
    try {
      Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
      verifier.initVerify(key);
      verifier.update(data);
      return verifier.verify(signature);
    } catch (GeneralSecurityException ex) {
      throw new SignatureVerificationException("Signature check failed: " + ex.getMessage(), ex);
    }
  }
}
