package eu.xfsc.cv.core.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Document loading options, bound from {@code credential-verifier.document-loader.*}.
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "credential-verifier.document-loader")
public class DocumentLoaderProperties {

  /** Load documents over https only. */
  private boolean secure = true;
  private Duration connectTimeout = Duration.ofSeconds(10);
  /** Bound for one document request, response body included. */
  private Duration requestTimeout = Duration.ofSeconds(30);
  private boolean cacheEnabled = true;
  private Duration cacheTtl = Duration.ofMinutes(15);
  private int cacheMaxEntries = 500;
  /** Document URL to classpath resource, served without network access. */
  private Map<String, String> staticContexts = new LinkedHashMap<>();

}
