package com.shiptrack.providers.shippo;

import com.fasterxml.jackson.databind.JsonNode;
import com.shiptrack.webhooks.WebhookSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Tests for ShippoClient against a mocked Shippo API.
 */
class ShippoClientTest {

    private static final String BASE_URL = "https://api.shippo.test";

    private MockRestServiceServer server;
    private ShippoClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ShippoClient(restTemplate, BASE_URL + "/", "test-token");
    }

    @Test
    void testCreateTracking_SendsTokenAndBody() {
        server.expect(requestTo(BASE_URL + "/tracks/"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "ShippoToken test-token"))
            .andExpect(jsonPath("$.carrier").value("usps"))
            .andExpect(jsonPath("$.tracking_number").value("9205590164917312751089"))
            .andRespond(withSuccess("{\"tracking_number\":\"9205590164917312751089\"}", MediaType.APPLICATION_JSON));

        JsonNode response = client.createTracking("usps", "9205590164917312751089");

        assertEquals("9205590164917312751089", response.get("tracking_number").asText());
        server.verify();
    }

    @Test
    void testGetTracking_ParsesTrack() {
        server.expect(requestTo(BASE_URL + "/tracks/ups/1Z999AA10123456784"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{"
                + "\"tracking_number\":\"1Z999AA10123456784\",\"carrier\":\"ups\","
                + "\"tracking_status\":{\"status\":\"TRANSIT\",\"status_details\":\"On its way\"},"
                + "\"eta\":\"2024-06-05T17:00:00Z\","
                + "\"tracking_history\":[{\"status\":\"TRANSIT\"}],"
                + "\"servicelevel\":{\"token\":\"ups_ground\"}}", MediaType.APPLICATION_JSON));

        ShippoDTOs.Track track = client.getTracking("ups", "1Z999AA10123456784");

        assertEquals("TRANSIT", track.getTrackingStatus().getStatus());
        assertEquals("On its way", track.getTrackingStatus().getStatusDetails());
        assertEquals(1, track.getTrackingHistory().size());
    }

    @Test
    void testListWebhooks_ReadsResults() {
        server.expect(requestTo(BASE_URL + "/webhooks"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"results\":[{"
                + "\"object_id\":\"wh_1\",\"url\":\"https://app.test/api/v1/webhooks/shippo\","
                + "\"event\":\"track_updated\",\"active\":true}]}", MediaType.APPLICATION_JSON));

        List<WebhookSubscription> webhooks = client.listWebhooks();

        assertEquals(1, webhooks.size());
        assertEquals("wh_1", webhooks.get(0).getId());
        assertEquals(Set.of("track_updated"), webhooks.get(0).getEvents());
        assertTrue(webhooks.get(0).isActive());
    }

    @Test
    void testCreateWebhook_OmitsNullFields() {
        server.expect(requestTo(BASE_URL + "/webhooks"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.url").value("https://app.test/hook"))
            .andExpect(jsonPath("$.active").doesNotExist())
            .andRespond(withSuccess("{\"id\":\"wh_2\",\"url\":\"https://app.test/hook\",\"active\":true}",
                MediaType.APPLICATION_JSON));

        WebhookSubscription created = client.createWebhook(ShippoDTOs.WebhookRequest.builder()
            .url("https://app.test/hook")
            .events(Set.of("track_updated"))
            .build());

        assertEquals("wh_2", created.getId());
    }

    @Test
    void testDeleteWebhook_NotFoundWrapped() {
        server.expect(requestTo(BASE_URL + "/webhooks/wh_missing"))
            .andExpect(method(HttpMethod.DELETE))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        ShippoApiException e = assertThrows(ShippoApiException.class, () -> client.deleteWebhook("wh_missing"));

        assertTrue(e.isNotFound());
        assertEquals("delete webhook", e.getOperation());
    }

    @Test
    void testTestWebhook_ServerErrorWrapped() {
        server.expect(requestTo(BASE_URL + "/webhooks/wh_1/test"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withServerError());

        ShippoApiException e = assertThrows(ShippoApiException.class, () -> client.testWebhook("wh_1"));

        assertEquals(500, e.getStatusCode());
        assertFalse(e.isNotFound());
    }

    @Test
    void testGetWebhook_IdWithTemplateCharactersEncoded() {
        server.expect(requestTo(BASE_URL + "/webhooks/%7Bid%7D%2Fx"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        ShippoApiException e = assertThrows(ShippoApiException.class, () -> client.getWebhook("{id}/x"));

        assertTrue(e.isNotFound());
        server.verify();
    }

    @Test
    void testTestWebhook_IdWithBracesEncoded() {
        server.expect(requestTo(BASE_URL + "/webhooks/%7Bid%7D/test"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess("{\"success\":true}", MediaType.APPLICATION_JSON));

        assertTrue(client.testWebhook("{id}"));
        server.verify();
    }

    @Test
    void testGetTracking_TrackingNumberWithSlashEncoded() {
        server.expect(requestTo(BASE_URL + "/tracks/usps/AB%2F12%7B3%7D"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"tracking_number\":\"AB/12{3}\"}", MediaType.APPLICATION_JSON));

        assertNotNull(client.getTracking("usps", "AB/12{3}"));
        server.verify();
    }
}
