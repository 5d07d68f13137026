package org.springaicommunity.github.mcp;

import java.util.regex.Pattern;

/**
 * Canonical {@code owner/name} reference to a GitHub repository.
 *
 * <p>
 * Instances are produced by {@link RepoIdentifierParser}. Both parts are restricted to the
 * characters GitHub accepts in owner and repository names.
 *
 * @param owner the account or organization that owns the repository
 * @param name the repository name (without owner)
 */
public record RepoIdentifier(String owner, String name) {

	static final Pattern NAME_PART = Pattern.compile("[A-Za-z0-9_.-]+");

	public RepoIdentifier {
		if (!NAME_PART.matcher(owner).matches()) {
			throw new IllegalArgumentException("Invalid repository owner: '" + owner + "'");
		}
		if (!NAME_PART.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid repository name: '" + name + "'");
		}
	}

	/**
	 * Path fragment used in REST calls, e.g. {@code /repos/acme/widgets}.
	 */
	public String apiPath() {
		return "/repos/" + owner + "/" + name;
	}

	@Override
	public String toString() {
		return owner + "/" + name;
	}

}
