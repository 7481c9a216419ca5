package com.example.albapikeyrotator.core.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Three-slot API key stored as the secret string.
 *
 * <p>Serialized as {@code {"key1": ..., "key2": ..., "key3": ...}}. {@code slotC} is the active key
 * pushed into load balancer rules; {@code slotA} and {@code slotB} are the two previous keys.
 *
 * @param slotA oldest key
 * @param slotB previous key
 * @param slotC active key
 */
@JsonPropertyOrder({"key1", "key2", "key3"})
public record CredentialPayload(
    @JsonProperty("key1") String slotA,
    @JsonProperty("key2") String slotB,
    @JsonProperty("key3") String slotC) {

  /**
   * The key load balancer rules must accept once this payload is live.
   *
   * @return {@code slotC}
   */
  public String activeKey() {
    return slotC;
  }

  @Override
  public String toString() {
    return "CredentialPayload[slotA=%s, slotB=%s, slotC=%s]"
        .formatted(Masking.mask(slotA), Masking.mask(slotB), Masking.mask(slotC));
  }
}
