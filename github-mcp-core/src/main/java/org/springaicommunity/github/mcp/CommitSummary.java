package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * A commit from the commit listing.
 *
 * @param message full commit message
 * @param author commit author name (git identity, not the GitHub login)
 * @param date authored date
 */
public record CommitSummary(String sha, String message, @Nullable String author, @Nullable String date,
		@Nullable String htmlUrl) {

	/**
	 * First line of the commit message.
	 */
	public String subject() {
		int newline = message.indexOf('\n');
		return (newline < 0 ? message : message.substring(0, newline)).stripTrailing();
	}

}
