package ch.so.arp.finrag.tools;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.finrag.llm.ToolDefinition;

/**
 * A tool the planner can invoke.
 */
public interface FinancialTool {

    ToolKind kind();

    /**
     * Name, description and input schema as declared to the model.
     */
    ToolDefinition definition();

    /**
     * Execute the tool.
     *
     * @param input   structured input sent by the model
     * @param context request scoped hints
     * @return payload and summary
     * @throws IllegalArgumentException if the input is invalid
     */
    ToolOutput execute(JsonNode input, ToolContext context);
}
