package shadeagent.relayer.config;

import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

/**
 * Shared OkHttpClient with connection pooling for the settlement, signer and ledger adapters.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient relayerHttpClient(RelayerProperties properties) {
        RelayerProperties.Http http = properties.getHttp();
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .connectTimeout(http.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(http.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
            .writeTimeout(http.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
            .build();
    }
}
