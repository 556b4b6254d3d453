package shadeagent.relayer.service.custody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.exception.FlowExecutionException;
import shadeagent.relayer.util.LogSanitizer;

/**
 * HTTP adapter for the chain-signature agent running next to the relayer.
 */
@Component
@Slf4j
public class ShadeAgentSignatureClient implements ChainSignatureClient {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public ShadeAgentSignatureClient(OkHttpClient httpClient, ObjectMapper objectMapper, RelayerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getSigner().getBaseUrl();
    }

    @Override
    public String requestSignature(String path, String payloadHex, KeyType keyType) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("payload", payloadHex);
        body.put("keyType", keyType.getWireValue());
        JsonNode response = post("/api/agent/sign", body, "sign");
        String signature = response.path("signature").asText(null);
        if (signature == null || signature.isBlank()) {
            throw new FlowExecutionException("sign", "Signing agent returned no signature for path " + path);
        }
        return signature;
    }

    @Override
    public String deriveAddress(String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("keyType", KeyType.EDDSA.getWireValue());
        JsonNode response = post("/api/agent/derive", body, "derive");
        String publicKey = response.path("publicKey").asText(null);
        if (publicKey == null || publicKey.isBlank()) {
            throw new FlowExecutionException("derive", "Signing agent returned no public key for path " + path);
        }
        return publicKey;
    }

    private JsonNode post(String endpoint, Map<String, Object> payload, String step) {
        HttpUrl url = HttpUrl.parse(baseUrl + endpoint);
        if (url == null) {
            throw new FlowExecutionException(step, "Invalid signer base URL: " + baseUrl);
        }
        try {
            RequestBody body = RequestBody.create(objectMapper.writeValueAsString(payload), JSON_MEDIA_TYPE);
            Request request = new Request.Builder().url(url).post(body).build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    log.warn("Signing agent {} responded with {}: {}", endpoint, response.code(), LogSanitizer.sanitize(text));
                    throw new FlowExecutionException(step, "Signing agent responded with HTTP " + response.code());
                }
                return objectMapper.readTree(text);
            }
        } catch (IOException e) {
            throw new FlowExecutionException(step, "Signing agent unreachable: " + e.getMessage(), e);
        }
    }
}
