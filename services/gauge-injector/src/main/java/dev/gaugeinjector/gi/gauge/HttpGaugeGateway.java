package dev.gaugeinjector.gi.gauge;

import java.math.BigInteger;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.ledger.AssetLedger;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Talks to gauges through an RPC bridge. After the bridge acknowledges a
 * deposit, the gauge's pull is booked on the custody ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpGaugeGateway implements GaugeGateway {
  private final RestTemplate gaugeRestTemplate;
  private final AssetLedger ledger;
  private final ObjectMapper om = new ObjectMapper();

  @Override
  public RewardData rewardData(String gauge, String asset) {
    JsonNode body;
    try {
      body = gaugeRestTemplate.getForObject("/gauges/{gauge}/reward-data/{asset}", JsonNode.class, gauge, asset);
    } catch (RestClientException e) {
      throw new GaugeCallException(gauge, "reward_data query failed", e);
    }
    if (body == null || !body.hasNonNull("period_finish"))
      throw new GaugeCallException(gauge, "reward_data response incomplete");

    String distributor = body.path("distributor").asText(Addresses.ZERO);
    long periodFinish = body.path("period_finish").asLong();
    return new RewardData(Addresses.isValid(distributor) ? Addresses.normalize(distributor) : Addresses.ZERO,
        periodFinish);
  }

  @Override
  public void depositRewardToken(String gauge, String asset, String custody, BigInteger amount) {
    ObjectNode req = om.createObjectNode();
    req.put("reward_token", asset);
    req.put("amount", amount.toString());
    req.put("from", custody);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);

    ResponseEntity<String> response;
    try {
      response = gaugeRestTemplate.postForEntity("/gauges/{gauge}/deposit-reward-token",
          new HttpEntity<>(req.toString(), headers), String.class, gauge);
    } catch (RestClientException e) {
      throw new GaugeCallException(gauge, "deposit_reward_token call failed", e);
    }
    if (!response.getStatusCode().is2xxSuccessful())
      throw new GaugeCallException(gauge, "deposit_reward_token returned " + response.getStatusCode());

    // the gauge pulls the approved amount
    try {
      ledger.transferFrom(asset, gauge, custody, gauge, amount);
    } catch (InjectorException e) {
      throw new GaugeCallException(gauge, "reward pull failed: " + e.getMessage(), e);
    }
    log.debug("deposit acknowledged gauge={} asset={} amount={}", gauge, asset, amount);
  }
}
