package eu.xfsc.cv.core.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import com.apicatalog.jsonld.loader.DocumentLoader;

import eu.xfsc.cv.core.service.crypto.BouncyCastleCryptoProvider;
import eu.xfsc.cv.core.service.crypto.CryptoProvider;
import eu.xfsc.cv.core.service.ld.LinkedDataCompactor;
import eu.xfsc.cv.core.service.ld.LinkedDataFramer;
import eu.xfsc.cv.core.service.ld.LinkedDataNormalizer;
import eu.xfsc.cv.core.service.ld.TitaniumCompactor;
import eu.xfsc.cv.core.service.ld.TitaniumFramer;
import eu.xfsc.cv.core.service.ld.TitaniumNormalizer;
import eu.xfsc.cv.core.service.verification.VerifierSettings;

/**
 * Credential verifier core configuration.
 */
@Configuration
@Import(DocumentLoaderConfig.class)
@EnableConfigurationProperties({VerifierProperties.class, DocumentLoaderProperties.class})
@ComponentScan(basePackages = {"eu.xfsc.cv.core.service"})
public class CoreConfig {

  @Bean
  public Clock verifierClock() {
    return Clock.systemUTC();
  }

  @Bean
  public LinkedDataFramer linkedDataFramer(DocumentLoader documentLoader) {
    return new TitaniumFramer(documentLoader);
  }

  @Bean
  public LinkedDataNormalizer linkedDataNormalizer(DocumentLoader documentLoader) {
    return new TitaniumNormalizer(documentLoader);
  }

  @Bean
  public LinkedDataCompactor linkedDataCompactor(DocumentLoader documentLoader) {
    return new TitaniumCompactor(documentLoader);
  }

  @Bean
  public CryptoProvider cryptoProvider() {
    return new BouncyCastleCryptoProvider();
  }

  @Bean
  public VerifierSettings verifierSettings(VerifierProperties properties, DocumentLoader documentLoader,
      LinkedDataFramer framer, LinkedDataNormalizer normalizer, LinkedDataCompactor compactor,
      CryptoProvider cryptoProvider, Clock verifierClock) {
    return VerifierSettings.builder()
        .documentLoader(documentLoader)
        .framer(framer)
        .normalizer(normalizer)
        .compactor(compactor)
        .cryptoProvider(cryptoProvider)
        .disableLocalFraming(properties.isDisableLocalFraming())
        .localBaseUri(properties.getLocalBaseUri())
        .contextUrl(properties.getContextUrl())
        .clock(verifierClock)
        .build();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService verificationExecutor(VerifierProperties properties) {
    return Executors.newFixedThreadPool(properties.getAsyncThreads());
  }
}
