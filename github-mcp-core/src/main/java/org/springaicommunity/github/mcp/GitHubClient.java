package org.springaicommunity.github.mcp;

import java.util.Map;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations (caching, logging).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo"), already URL-encoded
	 * @param queryParameters query parameters, encoded and appended in iteration order
	 * @return Response body as String
	 * @throws GitHubApiException if the API answers with an error status
	 * @throws GitHubTransportException if the request could not be completed
	 */
	String get(String path, Map<String, String> queryParameters);

	/**
	 * Execute a GET request without query parameters.
	 * @param path API path (e.g., "/repos/owner/repo")
	 * @return Response body as String
	 */
	default String get(String path) {
		return get(path, Map.of());
	}

}
