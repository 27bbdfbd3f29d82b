package ch.so.arp.finrag.tools;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.finrag.llm.ToolDefinition;
import ch.so.arp.finrag.resilience.RequestCancelledException;
import ch.so.arp.finrag.resilience.ResilientCallExecutor;

/**
 * Lookup table of the available tools, built once at startup. Every execution
 * runs through the {@link ResilientCallExecutor} under the dependency name
 * {@code tool-<name>}; failures are returned as unsuccessful
 * {@link ToolResult}s rather than thrown.
 */
public class ToolRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolKind, FinancialTool> tools = new EnumMap<>(ToolKind.class);
    private final ResilientCallExecutor executor;

    public ToolRegistry(Collection<? extends FinancialTool> tools, ResilientCallExecutor executor) {
        for (FinancialTool tool : tools) {
            if (this.tools.put(tool.kind(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool " + tool.kind().wireName());
            }
        }
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(FinancialTool::definition).toList();
    }

    public Optional<FinancialTool> find(String name) {
        return ToolKind.fromWireName(name).map(tools::get);
    }

    static String dependencyName(ToolKind kind) {
        return "tool-" + kind.wireName();
    }

    /**
     * Execute a tool by name.
     *
     * @throws RequestCancelledException if the request was cancelled while the
     *                                   tool was running
     */
    public ToolResult execute(String name, JsonNode input, ToolContext context) {
        long start = System.nanoTime();
        Optional<FinancialTool> tool = find(name);
        if (tool.isEmpty()) {
            LOGGER.warn("Planner requested unknown tool {}", name);
            return ToolResult.failure(name, "Unknown tool: " + name, 0L);
        }
        FinancialTool selected = tool.get();
        try {
            ToolOutput output = executor.call(dependencyName(selected.kind()), () -> selected.execute(input, context));
            return ToolResult.success(name, output, elapsedMillis(start));
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.warn("Tool {} failed: {}", name, ex.getMessage());
            return ToolResult.failure(name, ex.getMessage(), elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
