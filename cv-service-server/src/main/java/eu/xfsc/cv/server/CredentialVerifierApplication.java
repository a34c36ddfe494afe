package eu.xfsc.cv.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CredentialVerifierApplication {

  public static void main(String[] args) {
    SpringApplication.run(CredentialVerifierApplication.class, args);
  }
}
