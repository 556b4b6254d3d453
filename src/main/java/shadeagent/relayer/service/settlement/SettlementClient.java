package shadeagent.relayer.service.settlement;

/**
 * External cross-chain swap service (1-Click). The base URL is passed on every call.
 */
public interface SettlementClient {

    ExecutionStatus getExecutionStatus(String baseUrl, String depositAddress, String depositMemo);

    QuoteResponse getQuote(String baseUrl, QuoteRequest request);
}
