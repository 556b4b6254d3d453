package shadeagent.relayer.service.settlement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fields of a quote the relayer uses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteResponse(
    String depositAddress,
    String depositMemo,
    String amountIn,
    String amountOut,
    String deadline
) {
}
