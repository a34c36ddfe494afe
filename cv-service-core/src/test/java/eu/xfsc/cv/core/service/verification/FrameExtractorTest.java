package eu.xfsc.cv.core.service.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.Map;

import org.junit.jupiter.api.Test;

import eu.xfsc.cv.core.exception.FramingException;
import eu.xfsc.cv.core.exception.ResolutionException;
import eu.xfsc.cv.core.pojo.DocumentRef;
import eu.xfsc.cv.core.service.ld.LinkedDataFramer;
import eu.xfsc.cv.core.service.ld.TitaniumFramer;
import eu.xfsc.cv.core.service.resolve.DocumentResolver;
import eu.xfsc.cv.core.service.resolve.InMemoryDocumentLoader;
import eu.xfsc.cv.core.service.resolve.StaticContextLoader;
import jakarta.json.Json;
import jakarta.json.JsonObject;

public class FrameExtractorTest {

  private static final String TEST_CONTEXT = "https://example.org/contexts/test/v1";
  private static final String CREDENTIAL_ID = "https://issuer.example.com/credentials/1";
  private static final String KEY_URL = "https://issuer.example.com/keys/1";

  private final InMemoryDocumentLoader documents = new InMemoryDocumentLoader();
  private final StaticContextLoader loader = new StaticContextLoader(
      Map.of(TEST_CONTEXT, "contexts/test-v1.jsonld"), documents);
  private final DocumentResolver resolver = new DocumentResolver(loader);

  private static JsonObject credential() {
    return Json.createObjectBuilder()
        .add("@context", TEST_CONTEXT)
        .add("id", CREDENTIAL_ID)
        .add("type", "Credential")
        .add("name", "Work Email")
        .add("signature", Json.createObjectBuilder()
            .add("type", "GraphSignature2012")
            .add("creator", KEY_URL)
            .add("signatureValue", "AAAA"))
        .build();
  }

  @Test
  public void extractsSignedObject() {
    FrameExtractor extractor = new FrameExtractor(resolver, new TitaniumFramer(loader), false, null);

    JsonObject match = extractor.extract(DocumentRef.ofDocument(credential()), Frames.signedObject(TEST_CONTEXT));

    assertEquals(TEST_CONTEXT, match.getString("@context"));
    assertEquals(CREDENTIAL_ID, match.getString("id"));
    assertEquals("Work Email", match.getString("name"));
    assertEquals(KEY_URL, match.getJsonObject("signature").getString("creator"));
  }

  @Test
  public void extractsDocumentLoadedByUrl() {
    documents.put(CREDENTIAL_ID, credential());
    FrameExtractor extractor = new FrameExtractor(resolver, new TitaniumFramer(loader), false, null);

    JsonObject match = extractor.extract(DocumentRef.ofUrl(CREDENTIAL_ID), Frames.signedObject(TEST_CONTEXT));

    assertEquals(CREDENTIAL_ID, match.getString("id"));
  }

  @Test
  public void noMatchIsReported() {
    JsonObject unsigned = Json.createObjectBuilder(credential()).remove("signature").build();
    FrameExtractor extractor = new FrameExtractor(resolver, new TitaniumFramer(loader), false, null);

    FramingException ex = assertThrows(FramingException.class,
        () -> extractor.extract(DocumentRef.ofDocument(unsigned), Frames.signedObject(TEST_CONTEXT)));
    assertEquals("No matching object found for frame.", ex.getMessage());
  }

  @Test
  public void localDocumentsSkipFramingWhenDisabled() {
    LinkedDataFramer framer = mock(LinkedDataFramer.class);
    FrameExtractor extractor = new FrameExtractor(resolver, framer, true, "https://issuer.example.com/");
    JsonObject credential = credential();

    assertSame(credential, extractor.extract(DocumentRef.ofDocument(credential), Frames.signedObject(TEST_CONTEXT)));
    verifyNoInteractions(framer);
  }

  @Test
  public void localFramingNeedsBaseUri() {
    LinkedDataFramer framer = (input, frame) -> Json.createObjectBuilder()
        .add("@graph", Json.createArrayBuilder().add(Json.createObjectBuilder().add("id", CREDENTIAL_ID)))
        .build();
    FrameExtractor extractor = new FrameExtractor(resolver, framer, true, null);

    JsonObject match = extractor.extract(DocumentRef.ofDocument(credential()), Frames.signedObject(TEST_CONTEXT));

    assertEquals(Json.createObjectBuilder().add("id", CREDENTIAL_ID).add("@context", TEST_CONTEXT).build(), match);
  }

  @Test
  public void unresolvableDocumentIsReported() {
    FrameExtractor extractor = new FrameExtractor(resolver, new TitaniumFramer(loader), false, null);

    assertThrows(ResolutionException.class,
        () -> extractor.extract(DocumentRef.ofUrl(KEY_URL), Frames.publicKey(TEST_CONTEXT)));
  }
}
