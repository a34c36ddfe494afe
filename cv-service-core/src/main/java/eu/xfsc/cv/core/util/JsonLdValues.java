package eu.xfsc.cv.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.json.JsonArray;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Accessors for values of compacted JSON-LD nodes.
 */
public final class JsonLdValues {

  private JsonLdValues() {
  }

  /**
   * Returns all values of the given property, wrapping a single value into a list.
   *
   * @param node the node to read
   * @param property the property name
   * @return the values, empty when the property is absent or {@code null}
   */
  public static List<JsonValue> getValues(JsonObject node, String property) {
    if (node == null) {
      return Collections.emptyList();
    }
    JsonValue value = node.get(property);
    if (value == null || value == JsonValue.NULL) {
      return Collections.emptyList();
    }
    if (value.getValueType() == JsonValue.ValueType.ARRAY) {
      return new ArrayList<>((JsonArray) value);
    }
    return List.of(value);
  }

  /**
   * Returns the lexical form of a property value. Strings, numbers, booleans and
   * {@code @value} objects are supported; for arrays the first element is used.
   *
   * @param node the node to read
   * @param property the property name
   * @return the lexical value, or {@code null} when absent or not a literal
   */
  public static String getString(JsonObject node, String property) {
    if (node == null) {
      return null;
    }
    return lexical(node.get(property));
  }

  /**
   * Returns the identifier of a node reference: either a plain string or an object with {@code id} / {@code @id}.
   *
   * @param value the reference
   * @return the identifier, or {@code null}
   */
  public static String getId(JsonValue value) {
    if (value == null) {
      return null;
    }
    switch (value.getValueType()) {
      case STRING:
        return ((JsonString) value).getString();
      case OBJECT:
        JsonObject obj = value.asJsonObject();
        String id = lexical(obj.get("id"));
        return id != null ? id : lexical(obj.get("@id"));
      default:
        return null;
    }
  }

  /**
   * Returns the first object value of the given property.
   *
   * @param node the node to read
   * @param property the property name
   * @return the embedded object, or {@code null}
   */
  public static JsonObject getObject(JsonObject node, String property) {
    for (JsonValue value : getValues(node, property)) {
      if (value.getValueType() == JsonValue.ValueType.OBJECT) {
        return value.asJsonObject();
      }
    }
    return null;
  }

  /**
   * Returns the lexical form of a literal value.
   *
   * @param value a string, number, boolean, {@code @value} object or array of those
   * @return the lexical value, or {@code null} when not a literal
   */
  public static String lexical(JsonValue value) {
    if (value == null) {
      return null;
    }
    switch (value.getValueType()) {
      case STRING:
        return ((JsonString) value).getString();
      case NUMBER:
        return ((JsonNumber) value).toString();
      case TRUE:
        return "true";
      case FALSE:
        return "false";
      case OBJECT:
        return lexical(value.asJsonObject().get("@value"));
      case ARRAY:
        JsonArray array = value.asJsonArray();
        return array.isEmpty() ? null : lexical(array.get(0));
      default:
        return null;
    }
  }
}
