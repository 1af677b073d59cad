package com.eainde.atlas.nodes;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.error.MaxIterationsExceededException;
import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.error.RunCancelledException;
import com.eainde.atlas.reasoning.ReasoningModel;
import com.eainde.atlas.reasoning.ReasoningOutput;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.run.RunContext;
import com.eainde.atlas.run.RunContextRegistry;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.run.RunState;
import com.eainde.atlas.run.ToolCallRequest;
import com.eainde.atlas.state.TravelAgentState;
import com.eainde.atlas.tools.ToolRegistry;
import com.eainde.atlas.workflow.GraphNodeState;
import com.eainde.atlas.workflow.GraphRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the reasoning model for the next step and routes on its answer.
 * <p>
 * A final answer is appended to the history, streamed as message deltas and becomes the
 * run's terminal output. Tool requests are appended as an assistant entry for the dispatch
 * node to pick up, unless the run has already used up its reasoning/tool cycles.
 */
@Slf4j
@Component
public class ReasoningNode extends AbstractRunNode {

    public static final String NAME = "reasoning";

    private final ReasoningModel reasoningModel;
    private final ToolRegistry toolRegistry;
    private final ExecutorService reasoningExecutor;
    private final AgentProperties properties;

    public ReasoningNode(RunContextRegistry contexts,
                         ReasoningModel reasoningModel,
                         ToolRegistry toolRegistry,
                         @Qualifier("reasoningExecutor") ExecutorService reasoningExecutor,
                         AgentProperties properties) {
        super(contexts);
        this.reasoningModel = reasoningModel;
        this.toolRegistry = toolRegistry;
        this.reasoningExecutor = reasoningExecutor;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Map<String, Object> execute(RunContext context) {
        RunState run = context.state();
        ReasoningOutput output = callModel(context);
        GraphNodeState next = GraphRouter.nextState(GraphNodeState.REASONING, output);

        if (next == GraphNodeState.END) {
            String answer = output.text();
            run.appendMessage(ConversationMessage.assistant(answer));
            run.finalizeOutput(answer);
            streamAnswer(context, answer);
            log.info("Run {} produced a final answer after {} tool cycles", context.runId(), run.iteration());
        } else {
            if (run.iteration() >= properties.getMaxIterations()) {
                throw new MaxIterationsExceededException(properties.getMaxIterations());
            }
            run.appendMessage(ConversationMessage.assistantToolCalls(output.text(), output.toolRequests()));
            log.info("Run {} requested {} tool call(s): {}", context.runId(), output.toolRequests().size(),
                    output.toolRequests().stream().map(ToolCallRequest::name).toList());
        }
        return TravelAgentState.route(next.name());
    }

    private ReasoningOutput callModel(RunContext context) {
        Duration timeout = context.boundedTimeout(properties.getReasoningTimeout());
        List<ConversationMessage> history = List.copyOf(context.state().messages());

        // cancel(true) interrupts the model call's worker thread.
        Future<ReasoningOutput> call = reasoningExecutor.submit(
                () -> reasoningModel.reason(history, toolRegistry.manifest()));
        try {
            ReasoningOutput output = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new ReasoningUnavailableException("Reasoning model returned no output");
            }
            return output;
        } catch (TimeoutException e) {
            call.cancel(true);
            if (timeout.compareTo(properties.getReasoningTimeout()) < 0) {
                throw new ReasoningUnavailableException("Run deadline exceeded during reasoning step", e);
            }
            throw new ReasoningUnavailableException("Reasoning step timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReasoningUnavailableException unavailable) {
                throw unavailable;
            }
            throw new ReasoningUnavailableException("Reasoning step failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new RunCancelledException(context.runId());
        }
    }

    // Chunks split after whitespace so that their concatenation is the answer.
    private static void streamAnswer(RunContext context, String answer) {
        if (answer.isEmpty()) {
            return;
        }
        for (String chunk : answer.split("(?<=\\s)")) {
            context.emit(RunEvent.messageDelta(context.runId(), chunk));
        }
    }
}
