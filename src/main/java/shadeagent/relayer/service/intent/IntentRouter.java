package shadeagent.relayer.service.intent;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.service.flow.ChainSwapFlow;
import shadeagent.relayer.service.flow.ExecutionFlow;
import shadeagent.relayer.service.flow.ProtocolDepositFlow;
import shadeagent.relayer.service.flow.ProtocolWithdrawFlow;

/**
 * Picks the execution flow for an intent. Flows are tried in a fixed order
 * (protocol deposit, protocol withdraw, chain swap) and the first match wins.
 */
@Component
public class IntentRouter {

    private final List<ExecutionFlow> flowsByPrecedence;

    @Autowired
    public IntentRouter(ProtocolDepositFlow depositFlow, ProtocolWithdrawFlow withdrawFlow, ChainSwapFlow swapFlow) {
        this(List.of(depositFlow, withdrawFlow, swapFlow));
    }

    IntentRouter(List<ExecutionFlow> flowsByPrecedence) {
        this.flowsByPrecedence = List.copyOf(flowsByPrecedence);
    }

    public ExecutionFlow resolve(ValidatedIntent intent) {
        return flowsByPrecedence.stream()
            .filter(flow -> flow.supports(intent))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No execution flow for intent " + intent.getIntentId()));
    }
}
