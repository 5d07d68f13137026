package org.springaicommunity.github.mcp;

/**
 * Thrown when a request to GitHub could not be completed: timeouts, DNS, TLS and
 * connection failures, or interruption.
 */
public class GitHubTransportException extends RuntimeException {

	public GitHubTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
