package shadeagent.relayer.service.settlement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.exception.FlowExecutionException;

@ExtendWith(MockitoExtension.class)
@DisplayName("OneClickSettlementClient Tests")
class OneClickSettlementClientTest {

    private static final String BASE_URL = "https://1click.test";

    @Mock
    private OkHttpClient httpClient;

    @Mock
    private Call call;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<Request> sent = new AtomicReference<>();

    private OneClickSettlementClient client(String apiToken) {
        RelayerProperties properties = new RelayerProperties();
        properties.getSettlement().setApiToken(apiToken);
        return new OneClickSettlementClient(httpClient, objectMapper, properties);
    }

    private void respond(int code, String json) throws IOException {
        when(httpClient.newCall(any())).thenAnswer(inv -> {
            sent.set(inv.getArgument(0));
            return call;
        });
        when(call.execute()).thenAnswer(inv -> new Response.Builder()
            .request(sent.get())
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message("status")
            .body(ResponseBody.create(json, MediaType.get("application/json")))
            .build());
    }

    @Nested
    @DisplayName("Status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should query status by deposit address and memo")
        void shouldQueryStatus() throws IOException {
            respond(200, "{\"status\":\"SUCCESS\",\"swapDetails\":{}}");

            ExecutionStatus status = client(null).getExecutionStatus(BASE_URL, "dep-addr", "memo-1");

            assertEquals("success", status.normalized());
            assertEquals("GET", sent.get().method());
            assertEquals("/v0/status", sent.get().url().encodedPath());
            assertEquals("dep-addr", sent.get().url().queryParameter("depositAddress"));
            assertEquals("memo-1", sent.get().url().queryParameter("depositMemo"));
            assertNull(sent.get().header("Authorization"));
        }

        @Test
        @DisplayName("Should omit a blank memo and send the bearer token")
        void shouldSendBearerToken() throws IOException {
            respond(200, "{\"status\":\"PENDING_DEPOSIT\"}");

            client("secret").getExecutionStatus(BASE_URL, "dep-addr", " ");

            assertNull(sent.get().url().queryParameter("depositMemo"));
            assertEquals("Bearer secret", sent.get().header("Authorization"));
        }

        @Test
        @DisplayName("Should report an empty status when the field is missing")
        void shouldHandleMissingStatus() throws IOException {
            respond(200, "{}");

            assertEquals("", client(null).getExecutionStatus(BASE_URL, "dep-addr", null).normalized());
        }

        @Test
        @DisplayName("Should turn HTTP errors into flow failures")
        void shouldFailOnHttpError() throws IOException {
            respond(503, "unavailable");

            FlowExecutionException ex = assertThrows(FlowExecutionException.class,
                () -> client(null).getExecutionStatus(BASE_URL, "dep-addr", null));
            assertEquals("status", ex.getStep());
            assertTrue(ex.getMessage().contains("HTTP 503"));
        }

        @Test
        @DisplayName("Should reject an invalid base URL")
        void shouldRejectInvalidBaseUrl() {
            assertThrows(FlowExecutionException.class,
                () -> client(null).getExecutionStatus("not a url", "dep-addr", null));
        }
    }

    @Nested
    @DisplayName("Quote Tests")
    class QuoteTests {

        private QuoteRequest request() {
            return QuoteRequest.builder()
                .originAsset("nep141:abc.omft.near")
                .destinationAsset("nep141:usdc.near")
                .amount("1000")
                .slippageTolerance(100)
                .recipient("alice.near")
                .refundTo("Refund")
                .deadline("2026-01-01T00:00:00Z")
                .build();
        }

        @Test
        @DisplayName("Should unwrap the nested quote")
        void shouldUnwrapQuote() throws IOException {
            respond(200, "{\"timestamp\":\"t\",\"quote\":{\"depositAddress\":\"dep\",\"amountOut\":\"990\"}}");

            QuoteResponse quote = client(null).getQuote(BASE_URL, request());

            assertEquals("dep", quote.depositAddress());
            assertEquals("990", quote.amountOut());
            assertEquals("POST", sent.get().method());
            assertEquals("/v0/quote", sent.get().url().encodedPath());

            Buffer buffer = new Buffer();
            sent.get().body().writeTo(buffer);
            JsonNode body = objectMapper.readTree(buffer.readUtf8());
            assertFalse(body.get("dry").asBoolean());
            assertEquals("EXACT_INPUT", body.get("swapType").asText());
            assertEquals("ORIGIN_CHAIN", body.get("depositType").asText());
            assertEquals("DESTINATION_CHAIN", body.get("recipientType").asText());
            assertEquals(100, body.get("slippageTolerance").asInt());
        }

        @Test
        @DisplayName("Should accept a flat quote body")
        void shouldAcceptFlatQuote() throws IOException {
            respond(200, "{\"depositAddress\":\"flat\"}");

            assertEquals("flat", client(null).getQuote(BASE_URL, request()).depositAddress());
        }

        @Test
        @DisplayName("Should wrap network errors")
        void shouldWrapNetworkErrors() throws IOException {
            when(httpClient.newCall(any())).thenReturn(call);
            when(call.execute()).thenThrow(new IOException("timeout"));

            FlowExecutionException ex = assertThrows(FlowExecutionException.class,
                () -> client(null).getQuote(BASE_URL, request()));
            assertEquals("quote", ex.getStep());
        }
    }
}
