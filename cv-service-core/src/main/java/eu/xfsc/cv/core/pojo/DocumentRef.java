package eu.xfsc.cv.core.pojo;

import java.util.Objects;

import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Reference to a linked-data document, given either inline or by URL.
 */
@lombok.Getter
@lombok.EqualsAndHashCode
public final class DocumentRef {

  private final String url;
  private final JsonObject document;

  private DocumentRef(String url, JsonObject document) {
    this.url = url;
    this.document = document;
  }

  public static DocumentRef ofUrl(String url) {
    return new DocumentRef(Objects.requireNonNull(url, "url"), null);
  }

  public static DocumentRef ofDocument(JsonObject document) {
    return new DocumentRef(null, Objects.requireNonNull(document, "document"));
  }

  public boolean isInline() {
    return document != null;
  }

  /**
   * Location of the referenced document: the URL, or the {@code id} of an inline document.
   *
   * @return the location, or {@code null} when an inline document carries no string {@code id}
   */
  public String getLocation() {
    if (url != null) {
      return url;
    }
    JsonValue id = document.get("id");
    if (id != null && id.getValueType() == JsonValue.ValueType.STRING) {
      return ((JsonString) id).getString();
    }
    return null;
  }

  @Override
  public String toString() {
    return isInline() ? "DocumentRef[inline id=" + getLocation() + "]" : "DocumentRef[" + url + "]";
  }
}
