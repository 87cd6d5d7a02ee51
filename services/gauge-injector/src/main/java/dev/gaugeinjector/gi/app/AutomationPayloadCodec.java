package dev.gaugeinjector.gi.app;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;

/**
 * Perform payload: base64url (unpadded) of a JSON array of gauge addresses.
 * Keepers treat it as opaque.
 */
@Component
public class AutomationPayloadCodec {
  private final ObjectMapper om = new ObjectMapper();

  public String encode(List<String> gauges) {
    ArrayNode arr = om.createArrayNode();
    gauges.forEach(arr::add);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(arr.toString().getBytes(StandardCharsets.UTF_8));
  }

  public List<String> decode(String payload) {
    if (payload == null || payload.isBlank())
      throw InjectorException.invalidInput("empty perform payload");
    JsonNode node;
    try {
      byte[] raw = Base64.getUrlDecoder().decode(payload.trim());
      node = om.readTree(new String(raw, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException | JsonProcessingException e) {
      throw new InjectorException(ErrorCode.INVALID_INPUT, "undecodable perform payload", e);
    }
    if (node == null || !node.isArray())
      throw InjectorException.invalidInput("perform payload is not a list");
    List<String> gauges = new ArrayList<>(node.size());
    for (JsonNode n : node) {
      if (!n.isTextual())
        throw InjectorException.invalidInput("perform payload entry is not an address");
      gauges.add(n.asText());
    }
    return gauges;
  }
}
