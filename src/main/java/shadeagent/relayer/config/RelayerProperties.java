package shadeagent.relayer.config;

import java.math.BigInteger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import shadeagent.relayer.dto.intent.IntentChain;

@Data
@Component
@ConfigurationProperties(prefix = "relayer")
public class RelayerProperties {

    /** The single destination chain this deployment executes on. */
    private IntentChain servedChain = IntentChain.SOLANA;

    private int defaultSlippageBps = 300;

    /** Exclusive upper bound for sourceAmount (2^128). */
    private BigInteger maxSourceAmount = BigInteger.ONE.shiftLeft(128);

    /** Skip all external calls and return deterministic dry-run identifiers. */
    private boolean dryRun = false;

    private Queue queue = new Queue();
    private Status status = new Status();
    private Poller poller = new Poller();
    private Custody custody = new Custody();
    private Signature signature = new Signature();
    private Settlement settlement = new Settlement();
    private Signer signer = new Signer();
    private Ledger ledger = new Ledger();
    private Http http = new Http();

    @Data
    public static class Queue {
        private boolean enabled = true;
        private String key = "near:intents";
        private String deadLetterKey = "near:intents:dead-letter";
        private long visibilityTimeoutMs = 30_000;
        private long pollTimeoutMs = 1_000;
        private int concurrency = 5;
        private int maxAttempts = 3;
        private long retryBackoffMs = 1_000;
        private long supervisorIntervalMs = 5_000;
    }

    @Data
    public static class Status {
        private long ttlSeconds = 86_400;
        private long cleanupIntervalMs = 3_600_000;
    }

    @Data
    public static class Poller {
        private boolean enabled = true;
        private long intervalMs = 5_000;
        /** Maximum time an intent may wait on an external settlement leg. */
        private long maxWaitMs = 3_600_000;
    }

    @Data
    public static class Custody {
        private String solanaBasePath = "solana-1";
        private String nearBasePath = "near-1";
    }

    @Data
    public static class Signature {
        /** When set, NEP-413 proofs must name this recipient. */
        private String expectedRecipient;
        private boolean requireMessageMatch = true;
    }

    @Data
    public static class Settlement {
        private String baseUrl = "http://localhost:8787";
        private String apiToken;
        private int quoteDeadlineMinutes = 30;
    }

    @Data
    public static class Signer {
        private String baseUrl = "http://localhost:3140";
    }

    @Data
    public static class Ledger {
        private String baseUrl = "http://localhost:8899";
        /** Lamports kept back from swaps to fund the destination token account. */
        private long rentReserveLamports = 2_100_000;
    }

    @Data
    public static class Http {
        private long connectTimeoutMs = 5_000;
        private long readTimeoutMs = 20_000;
    }
}
