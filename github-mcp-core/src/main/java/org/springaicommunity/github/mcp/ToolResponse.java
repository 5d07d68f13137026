package org.springaicommunity.github.mcp;

/**
 * Marker for values returned by a tool: either a tool-specific result record or a
 * {@link ToolError}. Serialized with snake_case keys.
 */
public interface ToolResponse {

}
