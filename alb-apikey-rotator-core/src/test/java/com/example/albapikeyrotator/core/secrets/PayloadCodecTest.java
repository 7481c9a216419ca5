package com.example.albapikeyrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import com.example.albapikeyrotator.core.MalformedPayloadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PayloadCodecTest {

  @AfterEach
  void cleanup() {
    PayloadCodec.setMapperSupplier(ObjectMapper::new);
  }

  @Test
  @DisplayName("Encodes slots as key1/key2/key3 in order")
  void encodesCanonicalForm() {
    final var json = PayloadCodec.encode(new CredentialPayload("a", "b", "c"));

    assertEquals("{\"key1\":\"a\",\"key2\":\"b\",\"key3\":\"c\"}", json);
  }

  @Test
  @DisplayName("Decodes a stored secret string")
  void decodesStoredSecret() {
    final var json =
        """
        {
          "key1": "oldest",
          "key2": "previous",
          "key3": "active"
        }
        """;

    final var payload = PayloadCodec.decode(json);

    assertEquals(new CredentialPayload("oldest", "previous", "active"), payload);
    assertEquals("active", payload.activeKey());
  }

  @Test
  @DisplayName("Quotes and backslashes survive without munging")
  void keepsSpecialCharacters() {
    final var tricky = new CredentialPayload("a\"b", "c\\d", "e'f");

    assertEquals(tricky, PayloadCodec.decode(PayloadCodec.encode(tricky)));
  }

  @Test
  @DisplayName("Rejects a payload missing a slot")
  void rejectsMissingSlot() {
    final var e =
        assertThrows(
            MalformedPayloadException.class,
            () -> PayloadCodec.decode("{\"key1\":\"a\",\"key2\":\"b\"}"));
    assertTrue(e.getMessage().contains("key3"));
  }

  @Test
  @DisplayName("Rejects blank slots")
  void rejectsBlankSlot() {
    assertThrows(
        MalformedPayloadException.class,
        () -> PayloadCodec.decode("{\"key1\":\" \",\"key2\":\"b\",\"key3\":\"c\"}"));
  }

  @Test
  @DisplayName("Rejects invalid JSON and unknown properties")
  void rejectsInvalidJson() {
    assertThrows(MalformedPayloadException.class, () -> PayloadCodec.decode("invalid json"));
    assertThrows(
        MalformedPayloadException.class,
        () -> PayloadCodec.decode("{\"key1\":\"a\",\"key2\":\"b\",\"key3\":\"c\",\"key4\":\"d\"}"));
    assertThrows(MalformedPayloadException.class, () -> PayloadCodec.decode("null"));
  }

  @Test
  @DisplayName("toString never shows clear-text keys")
  void toStringMasksKeys() {
    final var payload = new CredentialPayload("AAAAsecret1", "BBBBsecret2", "CCCCsecret3");

    final var text = payload.toString();

    assertFalse(text.contains("secret"));
    assertTrue(text.contains("CC****(11)"));
  }

  @Test
  @DisplayName("Uses the configured mapper supplier")
  void usesConfiguredMapper() {
    final var calls = new int[] {0};
    PayloadCodec.setMapperSupplier(
        () -> {
          calls[0]++;
          return new ObjectMapper();
        });

    PayloadCodec.decode(PayloadCodec.encode(new CredentialPayload("a", "b", "c")));

    assertEquals(2, calls[0]);
  }
}
