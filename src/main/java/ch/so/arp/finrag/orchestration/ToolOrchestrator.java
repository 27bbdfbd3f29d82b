package ch.so.arp.finrag.orchestration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.financials.TickerAliases;
import ch.so.arp.finrag.llm.CompletionRequest;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.llm.ModelResponse;
import ch.so.arp.finrag.llm.ToolChoice;
import ch.so.arp.finrag.llm.ToolResultBlock;
import ch.so.arp.finrag.llm.ToolUse;
import ch.so.arp.finrag.resilience.RequestCancelledException;
import ch.so.arp.finrag.tools.ToolContext;
import ch.so.arp.finrag.tools.ToolKind;
import ch.so.arp.finrag.tools.ToolRegistry;
import ch.so.arp.finrag.tools.ToolResult;

/**
 * Drives the language model planner and the financial tools until an answer
 * is produced, writing every step to an {@link EventSink}.
 * <p>
 * The loop is bounded: after {@code maxToolLoops} tool iterations, or once
 * {@code maxTotalToolCalls} tools ran, the planner is told to answer with the
 * data it has and called one last time with tool choice {@code none}. A run
 * therefore ends with either content followed by {@code metrics} and
 * {@code end}, or with an {@code error} frame.
 */
public class ToolOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolOrchestrator.class);

    static final String PREFETCH_TOOL_ID = "auto-financials";

    private static final List<String> PREFETCH_METRICS = List.of("revenue", "revenue_segments", "operating_income",
            "net_income");

    private final LanguageModel languageModel;
    private final ToolRegistry toolRegistry;
    private final FinancialDataRepository financialData;
    private final OrchestrationProperties properties;
    private final OutputGuardrails guardrails;

    public ToolOrchestrator(LanguageModel languageModel, ToolRegistry toolRegistry,
            FinancialDataRepository financialData, OrchestrationProperties properties) {
        this.languageModel = Objects.requireNonNull(languageModel, "languageModel");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry");
        this.financialData = Objects.requireNonNull(financialData, "financialData");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.guardrails = new OutputGuardrails(properties.getProhibitedPhrases(), properties.getMaxResponseLength());
    }

    /**
     * Answer one question. Blocks the calling thread until the stream is
     * finished; interrupting the thread cancels the run.
     *
     * @return the final conversation state, mainly for diagnostics
     */
    public ConversationState run(ChatTurn turn, EventSink sink) {
        GuardedEventSink events = new GuardedEventSink(sink);
        RunMetrics metrics = new RunMetrics(System.nanoTime());
        ConversationState state = new ConversationState(turn.history(), turn.message());
        try {
            List<String> tickers = turn.tickers().isEmpty() ? TickerAliases.detect(turn.message()) : turn.tickers();
            ToolContext context = new ToolContext(turn.strategy(), tickers);

            events.emit(StreamEvent.metadata(turn.requestId(), dataFreshness()));
            events.emit(StreamEvent.status("Analyzing your question..."));

            if (shouldPrefetch(turn.message(), tickers)) {
                prefetchFinancials(tickers.get(0), state, context, events, metrics);
            }
            runLoop(turn.requestId(), state, context, events, metrics);

            state.terminate();
            events.emit(StreamEvent.metrics(metrics.toFields(System.nanoTime())));
            events.emit(StreamEvent.end(turn.requestId()));
        } catch (RequestCancelledException ex) {
            LOGGER.info("Request {} cancelled: {}", turn.requestId(), ex.getMessage());
            events.close();
        } catch (RuntimeException ex) {
            LOGGER.error("Request {} failed: {}", turn.requestId(), ex.getMessage(), ex);
            emitError(turn.requestId(), events, ex);
        } finally {
            state.terminate();
        }
        return state;
    }

    private void runLoop(String requestId, ConversationState state, ToolContext context, GuardedEventSink events,
            RunMetrics metrics) {
        while (true) {
            checkCancelled();
            boolean forced = state.loopCount() >= properties.getMaxToolLoops()
                    || state.totalToolCalls() >= properties.getMaxTotalToolCalls();
            if (forced) {
                LOGGER.warn("Request {} reached the tool limit after {} iterations and {} tool calls, forcing an answer",
                        requestId, state.loopCount(), state.totalToolCalls());
                state.appendUserInstruction(SystemPrompts.FORCE_ANSWER);
            }
            if (metrics.plannerCalls() > 0) {
                events.emit(StreamEvent.status("Reviewing results...",
                        Map.of("phase", "planning", "step", metrics.plannerCalls() + 1)));
            }

            state.transitionTo(LoopState.PLANNING);
            CompletionRequest request = completionRequest(state, forced ? ToolChoice.NONE : ToolChoice.AUTO);
            ModelResponse response = languageModel.complete(request);
            metrics.plannerCalled();
            LOGGER.debug("Request {} planner call {} returned {} tool uses, stop reason {}", requestId,
                    metrics.plannerCalls(), response.toolUses().size(), response.stopReason());

            if (forced || !response.hasToolUses()) {
                if (response.hasToolUses()) {
                    LOGGER.warn("Request {} planner asked for {} tools on the final call, ignoring them", requestId,
                            response.toolUses().size());
                }
                state.transitionTo(LoopState.STREAMING_FINAL);
                emitAnswer(response.text(), request, events, metrics);
                return;
            }

            int budget = Math.min(properties.getMaxToolCallsPerLoop(),
                    properties.getMaxTotalToolCalls() - state.totalToolCalls());
            List<ToolUse> toolUses = response.toolUses();
            if (toolUses.size() > budget) {
                LOGGER.warn("Request {} planner asked for {} tools, running {}", requestId, toolUses.size(), budget);
                toolUses = toolUses.subList(0, budget);
            }
            state.addAssistantTurn(response.text(), toolUses);

            state.transitionTo(LoopState.EXECUTING_TOOLS);
            events.emit(StreamEvent.status(toolUses.size() > 1
                    ? "Searching " + toolUses.size() + " sources..."
                    : "Searching knowledge base..."));
            List<ToolResultBlock> results = new ArrayList<>();
            for (ToolUse toolUse : toolUses) {
                checkCancelled();
                ToolResult result = executeTool(toolUse, state, context, events, metrics);
                results.add(result.toResultBlock(toolUse.id()));
            }
            state.addToolResults(results);
            state.iterationCompleted();
        }
    }

    private ToolResult executeTool(ToolUse toolUse, ConversationState state, ToolContext context,
            GuardedEventSink events, RunMetrics metrics) {
        state.toolCalled();
        events.emit(StreamEvent.toolStart(toolUse.name(), toolUse.id(), toolUse.input()));
        ToolResult result = toolRegistry.execute(toolUse.name(), toolUse.input(), context);
        metrics.toolCompleted(result);
        events.emit(StreamEvent.toolResult(toolUse.name(), toolUse.id(), result.success(),
                result.success() ? result.payload() : null, result.error(), result.latencyMs()));
        return result;
    }

    private void prefetchFinancials(String ticker, ConversationState state, ToolContext context,
            GuardedEventSink events, RunMetrics metrics) {
        events.emit(StreamEvent.status("Fetching latest " + ticker + " financials..."));
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("ticker", ticker);
        input.putArray("periods").addObject().put("fiscalYear", "latest");
        PREFETCH_METRICS.forEach(input.putArray("metrics")::add);

        ToolUse toolUse = new ToolUse(PREFETCH_TOOL_ID, ToolKind.FETCH_MULTI_PERIOD.wireName(), input);
        ToolResult result = executeTool(toolUse, state, context, events, metrics);
        state.addAssistantTurn("", List.of(toolUse));
        state.addToolResults(List.of(result.toResultBlock(toolUse.id())));
    }

    private void emitAnswer(String text, CompletionRequest planningRequest, GuardedEventSink events,
            RunMetrics metrics) {
        if (!text.isBlank()) {
            OutputGuardrails.Sanitized sanitized = guardrails.sanitize(text);
            reportViolations(sanitized.violations(), events);
            emitChunks(sanitized.text(), events, metrics);
        } else {
            // the planner returned neither text nor usable tools, ask for a streamed answer
            CompletionRequest streamRequest = new CompletionRequest(planningRequest.systemPrompt(),
                    planningRequest.messages(), planningRequest.tools(), ToolChoice.NONE,
                    planningRequest.maxTokens(), planningRequest.temperature());
            OutputGuardrails.FragmentFilter filter = guardrails.fragmentFilter();
            languageModel.stream(streamRequest, token -> {
                checkCancelled();
                emitContent(filter.accept(token), events, metrics);
            });
            emitContent(filter.finish(), events, metrics);
            metrics.plannerCalled();
            reportViolations(filter.violations(), events);
        }
        if (!metrics.hasContent()) {
            LOGGER.warn("Planner produced no answer text, sending fallback answer");
            emitChunks(SystemPrompts.FALLBACK_ANSWER, events, metrics);
        }
    }

    private void emitChunks(String text, GuardedEventSink events, RunMetrics metrics) {
        int chunkSize = Math.max(1, properties.getContentChunkSize());
        for (int i = 0; i < text.length(); i += chunkSize) {
            checkCancelled();
            emitContent(text.substring(i, Math.min(text.length(), i + chunkSize)), events, metrics);
        }
    }

    private static void emitContent(String text, GuardedEventSink events, RunMetrics metrics) {
        if (text.isEmpty()) {
            return;
        }
        metrics.contentEmitted(text, System.nanoTime());
        events.emit(StreamEvent.content(text));
    }

    private static void reportViolations(List<String> violations, GuardedEventSink events) {
        if (!violations.isEmpty()) {
            events.emit(StreamEvent.status("Guardrails applied: " + String.join("; ", violations)));
        }
    }

    private CompletionRequest completionRequest(ConversationState state, ToolChoice toolChoice) {
        return new CompletionRequest(SystemPrompts.ANALYST, state.messages(), toolRegistry.definitions(), toolChoice,
                properties.getMaxTokens(), properties.getTemperature());
    }

    private boolean shouldPrefetch(String message, List<String> tickers) {
        if (!properties.isPrefetchFinancials() || tickers.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return properties.getPrefetchKeywords().stream().anyMatch(lower::contains);
    }

    private Map<String, String> dataFreshness() {
        Map<String, String> freshness = new LinkedHashMap<>();
        financialData.tickers().stream()
                .sorted()
                .forEach(ticker -> financialData.mostRecentPeriod(ticker)
                        .ifPresent(period -> freshness.put(ticker, period.label())));
        return freshness;
    }

    private static void emitError(String requestId, GuardedEventSink events, RuntimeException failure) {
        try {
            events.emit(StreamEvent.error(failure.getMessage()));
        } catch (RequestCancelledException ex) {
            LOGGER.info("Request {} error frame not delivered, client is gone", requestId);
            events.close();
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException("Request cancelled");
        }
    }
}
