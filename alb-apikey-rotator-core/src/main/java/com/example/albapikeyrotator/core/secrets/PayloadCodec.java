package com.example.albapikeyrotator.core.secrets;

import com.example.albapikeyrotator.core.MalformedPayloadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/**
 * Canonical JSON encoding of {@link CredentialPayload}.
 *
 * <p>Unknown properties in stored secrets are rejected along with missing or blank slots, since
 * a partially parsed payload would silently drop keys from the chain.
 */
public final class PayloadCodec {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private PayloadCodec() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used for both directions.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Parses a stored secret string.
   *
   * @param secretString raw secret string
   * @return the parsed payload
   * @throws MalformedPayloadException if the string is not a complete payload
   */
  public static CredentialPayload decode(final String secretString) {
    final CredentialPayload payload;
    try {
      payload = mapperSupplier.get().readValue(secretString, CredentialPayload.class);
    } catch (final JsonProcessingException e) {
      throw new MalformedPayloadException(
          "Secret string is not a credential payload: " + e.getOriginalMessage(), e);
    }
    if (payload == null) throw new MalformedPayloadException("Secret string is empty");
    requireSlot("key1", payload.slotA());
    requireSlot("key2", payload.slotB());
    requireSlot("key3", payload.slotC());
    return payload;
  }

  /**
   * Serializes a payload into its stored form.
   *
   * @param payload payload to encode
   * @return JSON object string
   */
  public static String encode(final CredentialPayload payload) {
    try {
      return mapperSupplier.get().writeValueAsString(payload);
    } catch (final JsonProcessingException e) {
      throw new MalformedPayloadException("Failed to encode credential payload", e);
    }
  }

  private static void requireSlot(final String name, final String value) {
    if (value == null || value.isBlank())
      throw new MalformedPayloadException("Credential payload is missing " + name);
  }
}
