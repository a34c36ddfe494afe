package eu.xfsc.cv.core.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.jsonld.loader.SchemeRouter;

import eu.xfsc.cv.core.service.resolve.CachingDocumentLoader;
import eu.xfsc.cv.core.service.resolve.HttpDocumentLoader;
import eu.xfsc.cv.core.service.resolve.StaticContextLoader;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the JSON-LD {@link DocumentLoader} shared by resolution, framing, normalization and compaction.
 */
@Slf4j
@Configuration
public class DocumentLoaderConfig {

  @Autowired
  private DocumentLoaderProperties properties;

  @Bean
  public DocumentLoader documentLoader(Clock verifierClock) {
    log.info("documentLoader; properties: {}", properties);
    java.net.http.HttpClient httpClient = java.net.http.HttpClient.newBuilder()
        .connectTimeout(properties.getConnectTimeout())
        .followRedirects(java.net.http.HttpClient.Redirect.NEVER)
        .build();
    HttpDocumentLoader httpLoader = new HttpDocumentLoader(httpClient, properties.getRequestTimeout(), properties.isSecure());

    SchemeRouter router = new SchemeRouter();
    router.set("https", httpLoader);
    if (!properties.isSecure()) {
      router.set("http", httpLoader);
    }
    DocumentLoader loader = router;
    if (!properties.getStaticContexts().isEmpty()) {
      loader = new StaticContextLoader(properties.getStaticContexts(), loader);
    }
    if (properties.isCacheEnabled()) {
      loader = new CachingDocumentLoader(loader, properties.getCacheTtl(), properties.getCacheMaxEntries(), verifierClock);
    }
    return loader;
  }
}
