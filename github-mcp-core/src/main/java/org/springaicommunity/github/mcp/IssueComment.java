package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * A comment on an issue or pull request conversation.
 */
public record IssueComment(@Nullable Long id, @Nullable String user, String body, @Nullable String createdAt,
		@Nullable String updatedAt, @Nullable String htmlUrl) {

}
