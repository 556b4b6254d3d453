package shadeagent.relayer.service.flow;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.exception.FlowExecutionException;
import shadeagent.relayer.util.Base58;
import shadeagent.relayer.util.LogSanitizer;

/**
 * OkHttp adapter for the transaction builder service.
 */
@Component
@Slf4j
public class HttpLedgerGateway implements LedgerGateway {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpLedgerGateway(OkHttpClient httpClient, ObjectMapper objectMapper, RelayerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getLedger().getBaseUrl();
    }

    @Override
    public PreparedTransaction prepare(TransactionRequest request) {
        JsonNode response = post("/transactions/" + request.getKind().getPathSegment(), request, "prepare");
        try {
            PreparedTransaction prepared = objectMapper.treeToValue(response, PreparedTransaction.class);
            if (prepared.messageHex() == null || prepared.signers() == null || prepared.signers().isEmpty()) {
                throw new FlowExecutionException("prepare", "Ledger gateway returned an incomplete transaction");
            }
            return prepared;
        } catch (IOException e) {
            throw new FlowExecutionException("prepare", "Unreadable prepared transaction: " + e.getMessage(), e);
        }
    }

    @Override
    public String broadcast(PreparedTransaction transaction, List<byte[]> signatures) {
        if (signatures.size() != transaction.signers().size()) {
            throw new FlowExecutionException("broadcast", "Expected " + transaction.signers().size()
                + " signatures, got " + signatures.size());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messageHex", transaction.messageHex());
        body.put("signatures", signatures.stream().map(Base58::encode).toList());
        JsonNode response = post("/transactions/send", body, "broadcast");
        String txId = response.path("txId").asText(null);
        if (txId == null || txId.isBlank()) {
            throw new FlowExecutionException("broadcast", "Ledger gateway returned no transaction id");
        }
        return txId;
    }

    private JsonNode post(String endpoint, Object payload, String step) {
        try {
            RequestBody body = RequestBody.create(objectMapper.writeValueAsString(payload), JSON_MEDIA_TYPE);
            Request request = new Request.Builder().url(baseUrl + endpoint).post(body).build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    log.warn("Ledger gateway {} responded with {}: {}", endpoint, response.code(), LogSanitizer.sanitize(text));
                    throw new FlowExecutionException(step, "Ledger gateway responded with HTTP " + response.code() + ": " + text);
                }
                return objectMapper.readTree(text);
            }
        } catch (IOException e) {
            throw new FlowExecutionException(step, "Ledger gateway unreachable: " + e.getMessage(), e);
        }
    }
}
