package org.springaicommunity.github.mcp;

/**
 * Thrown when the GitHub API answers with a non-success status.
 *
 * <p>
 * The message carries the status code and a bounded excerpt of the response body.
 */
public class GitHubApiException extends RuntimeException {

	static final int BODY_EXCERPT_CHARS = 300;

	private final int statusCode;

	private final String bodyExcerpt;

	public GitHubApiException(int statusCode, String responseBody) {
		this(statusCode, responseBody, excerpt(responseBody));
	}

	private GitHubApiException(int statusCode, String responseBody, String bodyExcerpt) {
		super("GitHub API error " + statusCode + ": " + bodyExcerpt);
		this.statusCode = statusCode;
		this.bodyExcerpt = bodyExcerpt;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getBodyExcerpt() {
		return bodyExcerpt;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

	private static String excerpt(String body) {
		if (body.codePointCount(0, body.length()) <= BODY_EXCERPT_CHARS) {
			return body;
		}
		return body.substring(0, body.offsetByCodePoints(0, BODY_EXCERPT_CHARS));
	}

}
