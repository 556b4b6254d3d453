package shadeagent.relayer.service.settlement;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * Body of a quote request. With {@code dry=false} the service allocates a deposit address.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuoteRequest {
    boolean dry;
    @Builder.Default
    String swapType = "EXACT_INPUT";
    int slippageTolerance;
    String originAsset;
    @Builder.Default
    String depositType = "ORIGIN_CHAIN";
    String destinationAsset;
    String amount;
    String refundTo;
    @Builder.Default
    String refundType = "ORIGIN_CHAIN";
    String recipient;
    @Builder.Default
    String recipientType = "DESTINATION_CHAIN";
    String deadline;
}
