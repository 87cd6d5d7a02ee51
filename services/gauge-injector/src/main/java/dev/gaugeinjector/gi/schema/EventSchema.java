package dev.gaugeinjector.gi.schema;

import com.networknt.schema.JsonSchema;

public enum EventSchema {
  INJECTOR_EVENT_V1("schemas/gi.injector.event.v1.schema.json", "gi.injector.event@v1");

  private final String resource;
  private final String header;
  private volatile JsonSchema schema;

  EventSchema(String resource, String header) {
    this.resource = resource;
    this.header = header;
  }

  public String header() {
    return header;
  }

  JsonSchema schema() {
    JsonSchema s = schema;
    if (s == null) {
      s = SchemaValidator.load(resource);
      schema = s;
    }
    return s;
  }
}
