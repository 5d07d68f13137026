package org.springaicommunity.github.mcp;

/**
 * Failure result of a tool call. Callers distinguish failures from results by the
 * presence of the {@code error} key.
 *
 * @param error human readable failure description
 * @param tool name of the tool that failed
 */
public record ToolError(String error, String tool) implements ToolResponse {

}
