package shadeagent.relayer.service.settlement;

import java.io.IOException;

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
 * OkHttp client for the 1-Click swap API ({@code /v0/status}, {@code /v0/quote}).
 */
@Component
@Slf4j
public class OneClickSettlementClient implements SettlementClient {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiToken;

    public OneClickSettlementClient(OkHttpClient httpClient, ObjectMapper objectMapper, RelayerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiToken = properties.getSettlement().getApiToken();
    }

    @Override
    public ExecutionStatus getExecutionStatus(String baseUrl, String depositAddress, String depositMemo) {
        HttpUrl.Builder url = endpoint(baseUrl, "v0/status").newBuilder()
            .addQueryParameter("depositAddress", depositAddress);
        if (depositMemo != null && !depositMemo.isBlank()) {
            url.addQueryParameter("depositMemo", depositMemo);
        }
        JsonNode body = execute(authorized(new Request.Builder().url(url.build()).get()).build(), "status");
        return new ExecutionStatus(body.path("status").asText(null));
    }

    @Override
    public QuoteResponse getQuote(String baseUrl, QuoteRequest quoteRequest) {
        try {
            RequestBody body = RequestBody.create(objectMapper.writeValueAsString(quoteRequest), JSON_MEDIA_TYPE);
            Request request = authorized(new Request.Builder().url(endpoint(baseUrl, "v0/quote")).post(body)).build();
            JsonNode response = execute(request, "quote");
            // deposit details are nested under "quote" in the live API
            JsonNode quote = response.has("quote") ? response.get("quote") : response;
            return objectMapper.treeToValue(quote, QuoteResponse.class);
        } catch (IOException e) {
            throw new FlowExecutionException("quote", "Unable to read quote: " + e.getMessage(), e);
        }
    }

    private HttpUrl endpoint(String baseUrl, String path) {
        HttpUrl base = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new FlowExecutionException("settlement", "Invalid settlement base URL: " + baseUrl);
        }
        return base.newBuilder().addPathSegments(path).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (apiToken != null && !apiToken.isBlank()) {
            builder.addHeader("Authorization", "Bearer " + apiToken);
        }
        return builder;
    }

    private JsonNode execute(Request request, String step) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.warn("Settlement {} request responded with {}: {}", step, response.code(), LogSanitizer.sanitize(text));
                throw new FlowExecutionException(step, "Settlement service responded with HTTP " + response.code());
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new FlowExecutionException(step, "Settlement service unreachable: " + e.getMessage(), e);
        }
    }
}
