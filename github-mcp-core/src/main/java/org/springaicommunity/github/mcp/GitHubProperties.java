package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Process-wide settings for talking to the GitHub API.
 *
 * <p>
 * Built once at startup (from the environment or from Spring properties under
 * {@code github.*}) and passed to the HTTP client. Nothing reads these values from a
 * global at request time.
 */
public class GitHubProperties {

	public static final String DEFAULT_API_BASE = "https://api.github.com";

	public static final String DEFAULT_USER_AGENT = "github-mcp/1.0";

	/**
	 * Personal access token. Requests are anonymous when unset.
	 */
	@Nullable
	private String token;

	/**
	 * Base URL of the REST API.
	 */
	private String apiBase = DEFAULT_API_BASE;

	/**
	 * Whether TLS certificates are verified.
	 */
	private boolean sslVerify = true;

	/**
	 * PEM bundle of additional trusted CA certificates.
	 */
	@Nullable
	private String sslCertFile;

	/**
	 * Connect and request timeout for each call.
	 */
	private Duration timeout = Duration.ofSeconds(30);

	private String userAgent = DEFAULT_USER_AGENT;

	/**
	 * Read settings from {@code GITHUB_TOKEN}, {@code GITHUB_API_BASE},
	 * {@code GITHUB_SSL_VERIFY} and {@code SSL_CERT_FILE}.
	 * @return properties populated from the environment
	 */
	public static GitHubProperties fromEnvironment() {
		GitHubProperties properties = new GitHubProperties();
		properties.setToken(EnvironmentSupport.get("GITHUB_TOKEN"));
		properties.setApiBase(EnvironmentSupport.get("GITHUB_API_BASE", DEFAULT_API_BASE));
		properties.setSslVerify(EnvironmentSupport.isEnabled("GITHUB_SSL_VERIFY", true));
		properties.setSslCertFile(EnvironmentSupport.get("SSL_CERT_FILE"));
		return properties;
	}

	@Nullable
	public String getToken() {
		return token;
	}

	public void setToken(@Nullable String token) {
		this.token = token;
	}

	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	public String getApiBase() {
		return apiBase;
	}

	public void setApiBase(String apiBase) {
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
	}

	public boolean isSslVerify() {
		return sslVerify;
	}

	public void setSslVerify(boolean sslVerify) {
		this.sslVerify = sslVerify;
	}

	@Nullable
	public String getSslCertFile() {
		return sslCertFile;
	}

	public void setSslCertFile(@Nullable String sslCertFile) {
		this.sslCertFile = sslCertFile;
	}

	public Duration getTimeout() {
		return timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = timeout;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

}
