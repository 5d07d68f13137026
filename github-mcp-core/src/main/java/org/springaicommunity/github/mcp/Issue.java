package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * An issue as returned by the issues API. Pull requests are also issues there;
 * {@code pullRequest} tells them apart.
 *
 * @param body issue body, empty when the issue has none
 * @param comments number of comments
 */
public record Issue(@Nullable Integer number, @Nullable String title, String body, @Nullable String state,
		boolean pullRequest, @Nullable String user, List<String> labels, List<String> assignees,
		@Nullable Integer comments, @Nullable String createdAt, @Nullable String updatedAt,
		@Nullable String htmlUrl) {

}
