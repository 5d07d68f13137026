package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Repository metadata from {@code GET /repos/{owner}/{repo}}.
 *
 * @param fullName the full repository name in "owner/repo" format
 * @param description the repository description (may be null)
 * @param defaultBranch the default branch name
 * @param language primary language detected by GitHub
 * @param license license display name
 * @param topics repository topics
 * @param stars stargazer count
 * @param forks fork count
 * @param openIssues open issue count (includes pull requests)
 * @param htmlUrl the web URL for the repository
 * @param cloneUrl HTTPS clone URL
 * @param updatedAt last update timestamp (ISO-8601)
 */
public record RepositoryInfo(@Nullable String fullName, @Nullable String description, @Nullable String defaultBranch,
		@Nullable String language, @Nullable String license, List<String> topics, @Nullable Integer stars,
		@Nullable Integer forks, @Nullable Integer openIssues, @Nullable String htmlUrl, @Nullable String cloneUrl,
		@Nullable String updatedAt) {

}
