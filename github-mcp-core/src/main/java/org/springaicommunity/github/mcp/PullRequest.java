package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A pull request from the pulls API. Counters such as {@code commits} or
 * {@code changedFiles} are only present on single-PR responses and are {@code null} in
 * listings.
 */
public record PullRequest(@Nullable Integer number, @Nullable String title, String body, @Nullable String state,
		@Nullable String user, @Nullable Boolean draft, List<String> labels, List<String> assignees,
		@Nullable Integer comments, @Nullable Integer commits, @Nullable Integer additions,
		@Nullable Integer deletions, @Nullable Integer changedFiles, @Nullable Boolean mergeable,
		@Nullable String mergeableState, @Nullable Boolean merged, @Nullable String headBranch,
		@Nullable String headSha, @Nullable String baseBranch, @Nullable String createdAt,
		@Nullable String updatedAt, @Nullable String htmlUrl) {

}
