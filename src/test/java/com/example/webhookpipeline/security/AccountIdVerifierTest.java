package com.example.webhookpipeline.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccountIdVerifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TiendanubeVerifier tiendanube = new TiendanubeVerifier(objectMapper, Clock.systemUTC());
    private final MercadoLibreVerifier mercadoLibre = new MercadoLibreVerifier(objectMapper, Clock.systemUTC());

    @Test
    void testTiendanubeMatchingStore() {
        String body = "{\"store_id\":123,\"event\":\"order/created\",\"id\":456}";
        VerificationResult result = tiendanube.verifyAndParse(body, null, "123", Map.of());

        assertTrue(result.isValid(), result.getError());
        assertEquals("tiendanube-order/created-456", result.getEvent().getId());
        assertEquals("order/created", result.getEvent().getType());
        assertEquals("123", result.getEvent().getAccountId());
        assertNull(tiendanube.getSignatureHeader(Map.of("x-anything", "1")));
    }

    @Test
    void testTiendanubeRepeatedUpdatesWithTimestampGetDistinctIds() {
        String first = "{\"store_id\":123,\"event\":\"order/updated\",\"id\":456,"
                + "\"updated_at\":\"2024-01-01T10:00:00+0000\"}";
        String second = "{\"store_id\":123,\"event\":\"order/updated\",\"id\":456,"
                + "\"updated_at\":\"2024-01-01T11:30:00+0000\"}";

        String firstId = tiendanube.verifyAndParse(first, null, "123", Map.of()).getEvent().getId();
        String secondId = tiendanube.verifyAndParse(second, null, "123", Map.of()).getEvent().getId();
        String retryId = tiendanube.verifyAndParse(first, null, "123", Map.of()).getEvent().getId();

        assertEquals("tiendanube-order/updated-456-2024-01-01T10:00:00+0000", firstId);
        assertNotEquals(firstId, secondId);
        assertEquals(firstId, retryId);
    }

    @Test
    void testTiendanubeUpdateWithoutTimestampSharesId() {
        String body = "{\"store_id\":123,\"event\":\"order/updated\",\"id\":456}";

        String firstId = tiendanube.verifyAndParse(body, null, "123", Map.of()).getEvent().getId();
        String secondId = tiendanube.verifyAndParse(body, null, "123", Map.of()).getEvent().getId();

        assertEquals("tiendanube-order/updated-456", firstId);
        assertEquals(firstId, secondId);
    }

    @Test
    void testTiendanubeStoreMismatch() {
        String body = "{\"store_id\":999,\"event\":\"order/created\",\"id\":456}";
        VerificationResult result = tiendanube.verifyAndParse(body, null, "123", Map.of());
        assertFalse(result.isValid());
        assertEquals("Store ID mismatch", result.getError());
    }

    @Test
    void testTiendanubeUnparsableBody() {
        VerificationResult result = tiendanube.verifyAndParse("{oops", null, "123", Map.of());
        assertFalse(result.isValid());
        assertTrue(result.getError().startsWith("Failed to parse Tiendanube webhook"));
    }

    @Test
    void testMercadoLibreUserMismatch() {
        String body = "{\"_id\":\"n1\",\"user_id\":42,\"topic\":\"orders_v2\",\"resource\":\"/orders/1\"}";
        VerificationResult result = mercadoLibre.verifyAndParse(body, null, "7", Map.of());
        assertFalse(result.isValid());
        assertEquals("User ID mismatch", result.getError());
    }

    @Test
    void testMercadoLibreParsesSentTimestamp() {
        String body = "{\"_id\":\"n1\",\"user_id\":42,\"topic\":\"orders_v2\",\"resource\":\"/orders/1\","
                + "\"sent\":\"2024-01-01T10:00:00Z\"}";
        VerificationResult result = mercadoLibre.verifyAndParse(body, null, "42", Map.of());

        assertTrue(result.isValid(), result.getError());
        assertEquals("n1", result.getEvent().getId());
        assertEquals("orders_v2", result.getEvent().getType());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), result.getEvent().getOccurredAt());
    }

    @Test
    void testMissingEventId() {
        VerificationResult result = mercadoLibre.verifyAndParse("{\"user_id\":42}", null, "42", Map.of());
        assertEquals("MercadoLibre webhook is missing an event id", result.getError());
    }
}
