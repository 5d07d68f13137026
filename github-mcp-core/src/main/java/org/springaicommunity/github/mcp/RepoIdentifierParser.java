package org.springaicommunity.github.mcp;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the accepted spellings of a repository reference into a
 * {@link RepoIdentifier}.
 *
 * <p>
 * Accepted forms, tried in order:
 * <ol>
 * <li>{@code owner/name}</li>
 * <li>{@code git@github.com:owner/name} with an optional {@code .git} suffix</li>
 * <li>{@code http(s)://github.com/owner/name} with an optional {@code .git} suffix and/or
 * trailing slash</li>
 * </ol>
 * Surrounding whitespace and a single pair of enclosing quotes are removed first.
 */
public final class RepoIdentifierParser {

	static final String UNPARSABLE_MESSAGE = "repo must be 'owner/repo' or a GitHub URL/SSH remote";

	private static final Pattern OWNER_REPO = Pattern.compile("([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+)");

	private static final Pattern SSH_REMOTE = Pattern
		.compile("git@github\\.com:([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+?)(?:\\.git)?");

	private static final Pattern HTTPS_REMOTE = Pattern
		.compile("https?://github\\.com/([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+?)(?:\\.git)?/?");

	private RepoIdentifierParser() {
	}

	/**
	 * Parse a repository reference.
	 * @param value explicit {@code owner/name}, SSH remote or HTTPS URL
	 * @return the canonical identifier
	 * @throws RepositoryResolutionException if the value matches none of the accepted forms
	 */
	public static RepoIdentifier parse(String value) {
		String candidate = stripQuotes(value.trim());

		for (Pattern pattern : new Pattern[] { OWNER_REPO, SSH_REMOTE, HTTPS_REMOTE }) {
			Matcher matcher = pattern.matcher(candidate);
			if (matcher.matches()) {
				return new RepoIdentifier(matcher.group(1), matcher.group(2));
			}
		}
		throw new RepositoryResolutionException(UNPARSABLE_MESSAGE);
	}

	/**
	 * Remove one layer of matching single or double quotes, then surrounding whitespace.
	 */
	static String stripQuotes(String value) {
		if (value.length() >= 2) {
			char first = value.charAt(0);
			char last = value.charAt(value.length() - 1);
			if ((first == '"' || first == '\'') && first == last) {
				return value.substring(1, value.length() - 1).trim();
			}
		}
		return value;
	}

}
