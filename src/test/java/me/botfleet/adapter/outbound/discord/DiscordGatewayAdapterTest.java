package me.botfleet.adapter.outbound.discord;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.domain.model.GatewayConnectException;
import me.botfleet.infrastructure.config.FleetProperties;
import me.botfleet.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscordGatewayAdapterTest {

    private static final String API = "https://discord.test/api/v10";

    private OkHttpMockEngine engine;
    private DiscordGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        FleetProperties properties = new FleetProperties();
        properties.getDiscord().setApiBaseUrl(API);
        adapter = new DiscordGatewayAdapter(properties, client, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    @Test
    void shouldResolveGatewayUrlWithBotAuthorization() throws GatewayConnectException {
        engine.enqueueJson(200, "{\"url\":\"wss://gateway.discord.test\",\"shards\":1}");

        String url = adapter.fetchGatewayUrl("abc.def");

        assertEquals("wss://gateway.discord.test", url);
        Request request = engine.takeRequest();
        assertEquals(API + "/gateway/bot", request.url().toString());
        assertEquals("Bot abc.def", request.header("Authorization"));
        assertEquals("GET", request.method());
    }

    @Test
    void shouldFlagRejectedToken() {
        engine.enqueueJson(401, "{\"message\":\"401: Unauthorized\",\"code\":0}");

        GatewayConnectException error = assertThrows(GatewayConnectException.class,
                () -> adapter.fetchGatewayUrl("bad"));

        assertTrue(error.isCredentialRejected());
        assertTrue(error.getMessage().contains("401"));
    }

    @Test
    void shouldTreatServerErrorAsTransientFailure() {
        engine.enqueueJson(502, "{}");

        GatewayConnectException error = assertThrows(GatewayConnectException.class,
                () -> adapter.fetchGatewayUrl("token"));

        assertFalse(error.isCredentialRejected());
    }

    @Test
    void shouldFailWhenGatewayUrlMissing() {
        engine.enqueueJson(200, "{\"shards\":1}");

        GatewayConnectException error = assertThrows(GatewayConnectException.class,
                () -> adapter.fetchGatewayUrl("token"));

        assertTrue(error.getMessage().contains("no url"));
    }

    @Test
    void shouldWrapNetworkFailure() {
        engine.enqueueFailure(new IOException("connection refused"));

        GatewayConnectException error = assertThrows(GatewayConnectException.class,
                () -> adapter.fetchGatewayUrl("token"));

        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void shouldFailConnectWithBlankTokenWithoutNetwork() {
        CompletableFuture<?> future = adapter.connect(" ", behavior(), null);

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        GatewayConnectException cause = assertInstanceOf(GatewayConnectException.class, error.getCause());
        assertTrue(cause.isCredentialRejected());
        assertNull(engine.takeRequest());
    }

    @Test
    void shouldFailConnectWhenLookupRejected() {
        engine.enqueueJson(403, "{}");

        CompletableFuture<?> future = adapter.connect("token", behavior(), null);

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(GatewayConnectException.class, error.getCause());
    }

    @Test
    void shouldTakeGatewayIntentsFromTemplateSetting() {
        BehaviorDescriptor custom = behavior().toBuilder()
                .settings(Map.of(DiscordGatewayAdapter.INTENTS_SETTING, "513"))
                .build();
        BehaviorDescriptor invalid = behavior().toBuilder()
                .settings(Map.of(DiscordGatewayAdapter.INTENTS_SETTING, "lots"))
                .build();

        assertEquals(513, adapter.gatewayIntents(custom));
        assertEquals(37377, adapter.gatewayIntents(invalid));
        assertEquals(37377, adapter.gatewayIntents(behavior()));
    }

    @Test
    void shouldReportPlatform() {
        assertEquals("discord", adapter.getPlatform());
    }

    private static BehaviorDescriptor behavior() {
        return BehaviorDescriptor.builder().identity("bot-1").personalityId("grug").displayName("Grug").build();
    }
}
