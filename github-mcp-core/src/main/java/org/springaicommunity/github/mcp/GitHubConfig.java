package org.springaicommunity.github.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the GitHub API client, the resolver and the tool services.
 *
 * <p>
 * {@link GitHubProperties} starts from the environment ({@code GITHUB_TOKEN},
 * {@code GITHUB_SSL_VERIFY}, {@code SSL_CERT_FILE}) and may be overridden through
 * {@code github.*} properties.
 */
@Configuration
public class GitHubConfig {

	@Bean
	@ConfigurationProperties(prefix = "github")
	public GitHubProperties gitHubProperties() {
		return GitHubProperties.fromEnvironment();
	}

	@Bean
	public GitHubClient gitHubClient(GitHubProperties gitHubProperties) {
		return new GitHubHttpClient(gitHubProperties);
	}

	/**
	 * Uses its own snake_case mapper; the application-wide {@link ObjectMapper} stays
	 * untouched for the protocol layer.
	 */
	@Bean
	public RestService restService(GitHubClient gitHubClient) {
		return new GitHubRestService(gitHubClient, ObjectMapperFactory.create());
	}

	@Bean
	public RepositoryResolver repositoryResolver() {
		return new RepositoryResolver();
	}

	@Bean
	public RepositoryToolService repositoryToolService(RepositoryResolver repositoryResolver,
			RestService restService) {
		return new RepositoryToolService(repositoryResolver, restService);
	}

	@Bean
	public ActionsToolService actionsToolService(RepositoryResolver repositoryResolver, RestService restService) {
		return new ActionsToolService(repositoryResolver, restService);
	}

	@Bean
	public IssueToolService issueToolService(RepositoryResolver repositoryResolver, RestService restService) {
		return new IssueToolService(repositoryResolver, restService);
	}

}
