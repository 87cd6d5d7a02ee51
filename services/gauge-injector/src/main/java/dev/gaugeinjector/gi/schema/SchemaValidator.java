package dev.gaugeinjector.gi.schema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

public final class SchemaValidator {
  private static final ObjectMapper OM = new ObjectMapper();
  private static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

  private SchemaValidator() {
  }

  static JsonSchema load(String resource) {
    InputStream in = SchemaValidator.class.getClassLoader().getResourceAsStream(resource);
    if (in == null)
      throw new IllegalStateException("schema resource missing: " + resource);
    try (in) {
      return FACTORY.getSchema(OM.readTree(in));
    } catch (IOException e) {
      throw new UncheckedIOException("schema resource unreadable: " + resource, e);
    }
  }

  /**
   * @throws IllegalArgumentException listing every violation, sorted
   */
  public static void validate(EventSchema schema, JsonNode instance) {
    Set<ValidationMessage> errors = schema.schema().validate(instance);
    if (errors.isEmpty())
      return;
    List<String> messages = errors.stream().map(ValidationMessage::getMessage).sorted().toList();
    throw new IllegalArgumentException(schema.header() + " violated: " + String.join("; ", messages));
  }
}
