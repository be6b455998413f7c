package com.harden.core.llm;

/**
 * A one-shot, stateless text-generation tool.
 * <p>
 * Each call receives a fully self-contained prompt and returns the tool's raw
 * text output. No conversation state is carried between calls.
 */
@FunctionalInterface
public interface ReasoningTool {

    /**
     * Runs the tool once.
     *
     * @param prompt the complete prompt
     * @return the trimmed raw output
     * @throws ToolInvocationException if the tool fails, times out or cannot be started
     */
    String invoke(String prompt);
}
