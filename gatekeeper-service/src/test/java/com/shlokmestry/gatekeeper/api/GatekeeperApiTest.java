package com.shlokmestry.gatekeeper.api;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.TestPropertySource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "gatekeeper.store=memory",
        "gatekeeper.index.rebuild-on-startup=true"
})
class GatekeeperApiTest {

    @LocalServerPort
    int port;

    @Autowired
    ObjectMapper json;

    private final HttpClient http = HttpClient.newHttpClient();

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .header("Content-Type", "application/json");
        HttpRequest req = body == null
                ? b.method(method, HttpRequest.BodyPublishers.noBody()).build()
                : b.method(method, HttpRequest.BodyPublishers.ofString(body)).build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void keyLifecycle_authorizeThenDeactivate() throws Exception {
        HttpResponse<String> created = send("POST", "/v1/keys", """
                {"ownerName":"Acme","contactEmail":"ops@acme.test"}
                """);
        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode key = json.readTree(created.body());
        String token = key.get("key").asText();
        long keyId = key.get("id").asLong();
        assertThat(token).hasSize(64);

        JsonNode ok = json.readTree(send("POST", "/v1/authorize",
                "{\"token\":\"" + token + "\",\"address\":\"198.51.100.1\"}").body());
        assertThat(ok.get("authenticated").asBoolean()).isTrue();
        assertThat(ok.get("keyId").asLong()).isEqualTo(keyId);
        assertThat(ok.get("banned").asBoolean()).isFalse();

        assertThat(send("POST", "/v1/keys/" + keyId + "/deactivate", null).statusCode()).isEqualTo(200);

        JsonNode after = json.readTree(send("POST", "/v1/authorize",
                "{\"token\":\"" + token + "\",\"address\":\"198.51.100.1\"}").body());
        assertThat(after.get("authenticated").asBoolean()).isFalse();
    }

    @Test
    void banLifecycle_createQueryRetire() throws Exception {
        HttpResponse<String> created = send("POST", "/v1/bans", """
                {"title":"crawler","ranges":["203.0.113.0/24"]}
                """);
        assertThat(created.statusCode()).isEqualTo(201);
        long banId = json.readTree(created.body()).get("id").asLong();

        JsonNode banned = json.readTree(send("POST", "/v1/authorize", """
                {"address":"203.0.113.77"}
                """).body());
        assertThat(banned.get("banned").asBoolean()).isTrue();

        assertThat(send("DELETE", "/v1/bans/" + banId, null).statusCode()).isEqualTo(204);

        JsonNode cleared = json.readTree(send("POST", "/v1/authorize", """
                {"address":"203.0.113.77"}
                """).body());
        assertThat(cleared.get("banned").asBoolean()).isFalse();
        assertThat(send("GET", "/v1/bans/" + banId, null).statusCode()).isEqualTo(404);
    }

    @Test
    void invalidRangeIsRejectedWith400() throws Exception {
        HttpResponse<String> resp = send("POST", "/v1/bans", """
                {"title":"bad","ranges":["10.0.0.0/99"]}
                """);

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(json.readTree(resp.body()).get("code").asText()).isEqualTo("invalid_range");
    }

    @Test
    void usageIsAccepted() throws Exception {
        HttpResponse<String> resp = send("POST", "/v1/usage", """
                {"address":"192.0.2.9","endpoint":"orders","timestamp":"2024-05-01T12:00:42Z",
                 "statusCode":200,"elapsedMillis":12,"responseBytes":300}
                """);

        assertThat(resp.statusCode()).isEqualTo(202);
    }

    @Test
    void malformedAddressIsRejectedWith400() throws Exception {
        HttpResponse<String> resp = send("POST", "/v1/authorize", """
                {"address":"not-an-ip"}
                """);

        assertThat(resp.statusCode()).isEqualTo(400);
    }

    @Test
    void unknownKeyIs404() throws Exception {
        assertThat(send("GET", "/v1/keys/987654", null).statusCode()).isEqualTo(404);
    }

    @Test
    void internalIndexReportsMatchingBans() throws Exception {
        HttpResponse<String> created = send("POST", "/v1/bans", """
                {"title":"v6","ranges":["2001:db8:aa::/48"]}
                """);
        long banId = json.readTree(created.body()).get("id").asLong();

        JsonNode status = json.readTree(send("GET", "/internal/index?address=2001:db8:aa::1", null).body());

        assertThat(status.get("matchingBans").toString()).contains(String.valueOf(banId));
        assertThat(send("POST", "/internal/index/rebuild", null).statusCode()).isEqualTo(200);
    }
}
