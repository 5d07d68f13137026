package org.springaicommunity.github.mcp.server;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link GitHubTools} with the MCP server.
 */
@Configuration
public class GitHubToolConfiguration {

	@Bean
	public ToolCallbackProvider githubToolCallbackProvider(GitHubTools tools) {
		return MethodToolCallbackProvider.builder().toolObjects(tools).build();
	}

}
