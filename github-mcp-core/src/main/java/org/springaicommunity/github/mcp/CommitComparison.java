package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of {@code GET /repos/{owner}/{repo}/compare/{base}...{head}}.
 */
public record CommitComparison(@Nullable String status, @Nullable Integer aheadBy, @Nullable Integer behindBy,
		@Nullable Integer totalCommits, List<ChangedFile> files, @Nullable String htmlUrl,
		@Nullable String permalinkUrl) {

}
