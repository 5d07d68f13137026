package org.springaicommunity.github.mcp.server;

import org.springaicommunity.github.mcp.GitHubConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * GitHub MCP Server Application
 *
 * Spring Boot application exposing read-only GitHub tools (repository info, files,
 * comparisons, workflow runs, issues, pull requests, commits) over the MCP stdio
 * transport. Every tool accepts an explicit repository or infers it from the git
 * configuration of a local working copy.
 *
 * Usage: java -jar github-mcp-server.jar
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token (optional),
 * GITHUB_SSL_VERIFY - set to false to disable certificate checks, SSL_CERT_FILE - PEM
 * bundle of trusted CAs
 */
@SpringBootApplication
@Import(GitHubConfig.class)
public class GitHubMcpServerApplication {

	public static void main(String[] args) {
		// stdout carries the protocol: no web server, no banner
		SpringApplication app = new SpringApplication(GitHubMcpServerApplication.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.run(args);
	}

}
