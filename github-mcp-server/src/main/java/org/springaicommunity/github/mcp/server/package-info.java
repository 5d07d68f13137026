/**
 * MCP server wiring for the GitHub tools.
 */
@NullMarked
package org.springaicommunity.github.mcp.server;

import org.jspecify.annotations.NullMarked;
