package eu.xfsc.cv.core.service.ld;

import java.io.StringWriter;
import java.util.Locale;

import com.apicatalog.jsonld.JsonLd;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.http.media.MediaType;
import com.apicatalog.jsonld.loader.DocumentLoader;
import com.apicatalog.rdf.Rdf;
import com.apicatalog.rdf.RdfDataset;

import eu.xfsc.cv.core.exception.NormalizationException;
import eu.xfsc.cv.core.pojo.CanonicalizationAlgorithm;
import io.setl.rdf.normalization.RdfNormalize;
import jakarta.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LinkedDataNormalizer} converting JSON-LD to RDF with Titanium and canonicalizing
 * the dataset with the SETL URDNA2015 / URGNA2012 implementation.
 */
@Slf4j
public class TitaniumNormalizer implements LinkedDataNormalizer {

  private final DocumentLoader documentLoader;

  public TitaniumNormalizer(DocumentLoader documentLoader) {
    this.documentLoader = documentLoader;
  }

  @Override
  public String normalize(JsonObject input, CanonicalizationAlgorithm algorithm) {
    log.debug("normalize.enter; algorithm: {}", algorithm);
    try {
      RdfDataset dataset = JsonLd.toRdf(JsonDocument.of(input))
          .loader(documentLoader)
          .get();
      RdfDataset canonical;
      if (algorithm == null || algorithm == CanonicalizationAlgorithm.DEFAULT) {
        canonical = RdfNormalize.normalize(dataset);
      } else {
        canonical = RdfNormalize.normalize(dataset, algorithm.name().toLowerCase(Locale.ROOT));
      }
      StringWriter writer = new StringWriter();
      Rdf.createWriter(MediaType.N_QUADS, writer).write(canonical);
      String nquads = writer.toString();
      log.debug("normalize.exit; produced {} chars", nquads.length());
      return nquads;
    } catch (Exception ex) {
      throw new NormalizationException("Normalization with " + algorithm + " failed: " + ex.getMessage(), ex);
    }
  }
}
