package shadeagent.relayer.service.custody;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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
@DisplayName("ShadeAgentSignatureClient Tests")
class ShadeAgentSignatureClientTest {

    @Mock
    private OkHttpClient httpClient;

    @Mock
    private Call call;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<Request> sent = new AtomicReference<>();
    private ShadeAgentSignatureClient client;

    @BeforeEach
    void setUp() {
        RelayerProperties properties = new RelayerProperties();
        properties.getSigner().setBaseUrl("http://agent.test");
        client = new ShadeAgentSignatureClient(httpClient, objectMapper, properties);
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

    private JsonNode sentBody() throws IOException {
        Buffer buffer = new Buffer();
        sent.get().body().writeTo(buffer);
        return objectMapper.readTree(buffer.readUtf8());
    }

    @Test
    @DisplayName("Should request an EdDSA signature for the path")
    void shouldRequestSignature() throws IOException {
        respond(200, "{\"signature\":\"ed25519:abc\"}");

        String signature = client.requestSignature("solana-1,user", "deadbeef", KeyType.EDDSA);

        assertEquals("ed25519:abc", signature);
        assertEquals("http://agent.test/api/agent/sign", sent.get().url().toString());
        JsonNode body = sentBody();
        assertEquals("solana-1,user", body.get("path").asText());
        assertEquals("deadbeef", body.get("payload").asText());
        assertEquals(KeyType.EDDSA.getWireValue(), body.get("keyType").asText());
    }

    @Test
    @DisplayName("Should derive the custody address for a path")
    void shouldDeriveAddress() throws IOException {
        respond(200, "{\"publicKey\":\"Custody111\"}");

        assertEquals("Custody111", client.deriveAddress("solana-1,user"));
        assertEquals("http://agent.test/api/agent/derive", sent.get().url().toString());
    }

    @Test
    @DisplayName("Should fail when the agent returns no signature")
    void shouldFailWithoutSignature() throws IOException {
        respond(200, "{}");

        FlowExecutionException ex = assertThrows(FlowExecutionException.class,
            () -> client.requestSignature("solana-1", "00", KeyType.EDDSA));
        assertEquals("sign", ex.getStep());
    }

    @Test
    @DisplayName("Should fail on agent HTTP errors")
    void shouldFailOnHttpError() throws IOException {
        respond(500, "boom");

        FlowExecutionException ex = assertThrows(FlowExecutionException.class,
            () -> client.deriveAddress("solana-1"));
        assertEquals("derive", ex.getStep());
        assertTrue(ex.getMessage().contains("HTTP 500"));
    }
}
