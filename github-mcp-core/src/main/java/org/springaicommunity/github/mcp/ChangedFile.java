package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * A file touched by a comparison. {@code patch} is absent for binary or very large
 * diffs.
 */
public record ChangedFile(@Nullable String filename, @Nullable String status, @Nullable Integer additions,
		@Nullable Integer deletions, @Nullable Integer changes, @Nullable String patch) {

}
