package org.springaicommunity.github.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Builder for creating the GitHub tool services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Settings from GITHUB_TOKEN, GITHUB_SSL_VERIFY, SSL_CERT_FILE (.env aware)
 * RepositoryToolService tools = GitHubMcpBuilder.create()
 *     .propertiesFromEnv()
 *     .buildRepositoryTools();
 *
 * ToolResponse info = tools.repoInfo("spring-projects/spring-ai", null);
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * IssueToolService testTools = GitHubMcpBuilder.create()
 *     .httpClient(mockClient)
 *     .workingDirectory(tempDir)
 *     .buildIssueTools();
 * }
 * </pre>
 */
public class GitHubMcpBuilder {

	private GitHubProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	@Nullable
	private Path workingDirectory;

	private GitHubMcpBuilder() {
		this.properties = new GitHubProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubMcpBuilder
	 */
	public static GitHubMcpBuilder create() {
		return new GitHubMcpBuilder();
	}

	/**
	 * Use explicit connection settings.
	 * @param properties settings (null to use defaults)
	 * @return this builder
	 */
	public GitHubMcpBuilder properties(@Nullable GitHubProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Read connection settings from the environment and {@code .env} files.
	 * @return this builder
	 */
	public GitHubMcpBuilder propertiesFromEnv() {
		this.properties = GitHubProperties.fromEnvironment();
		return this;
	}

	/**
	 * Set a custom ObjectMapper used to read API responses.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubMcpBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubMcpBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Directory used for repository inference when a call gives no root path.
	 * @param workingDirectory directory (null to use the process working directory)
	 * @return this builder
	 */
	public GitHubMcpBuilder workingDirectory(@Nullable Path workingDirectory) {
		this.workingDirectory = workingDirectory;
		return this;
	}

	public RepositoryToolService buildRepositoryTools() {
		return new RepositoryToolService(buildResolver(), buildRestService());
	}

	public ActionsToolService buildActionsTools() {
		return new ActionsToolService(buildResolver(), buildRestService());
	}

	public IssueToolService buildIssueTools() {
		return new IssueToolService(buildResolver(), buildRestService());
	}

	/**
	 * Build the typed REST service.
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		return new GitHubRestService(getOrCreateHttpClient(), getOrCreateObjectMapper());
	}

	/**
	 * Build the repository resolver.
	 * @return configured RepositoryResolver
	 */
	public RepositoryResolver buildResolver() {
		return workingDirectory != null ? new RepositoryResolver(workingDirectory) : new RepositoryResolver();
	}

	private GitHubClient getOrCreateHttpClient() {
		if (httpClient == null) {
			httpClient = new GitHubHttpClient(properties);
		}
		return httpClient;
	}

	private ObjectMapper getOrCreateObjectMapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

}
