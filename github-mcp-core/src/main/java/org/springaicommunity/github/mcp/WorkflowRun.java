package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * A GitHub Actions workflow run.
 */
public record WorkflowRun(@Nullable Long id, @Nullable String name, @Nullable String displayTitle,
		@Nullable String event, @Nullable String status, @Nullable String conclusion, @Nullable String createdAt,
		@Nullable String updatedAt, @Nullable Integer runNumber, @Nullable String headBranch,
		@Nullable String headSha, @Nullable String htmlUrl, @Nullable Integer attempt) {

}
