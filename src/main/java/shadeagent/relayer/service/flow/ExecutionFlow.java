package shadeagent.relayer.service.flow;

import shadeagent.relayer.dto.intent.ValidatedIntent;

/**
 * One way of executing an intent on the destination chain.
 */
public interface ExecutionFlow {

    String name();

    boolean supports(ValidatedIntent intent);

    /**
     * @throws shadeagent.relayer.exception.FlowExecutionException when a step fails; the caller retries
     */
    FlowResult execute(ValidatedIntent intent);
}
