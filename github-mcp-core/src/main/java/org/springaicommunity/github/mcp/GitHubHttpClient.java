package org.springaicommunity.github.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * HTTP client for GitHub REST API calls using the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Every request carries the same headers, timeout and TLS trust configuration, all taken
 * from the {@link GitHubProperties} given at construction. Error statuses become
 * {@link GitHubApiException}; I/O failures and timeouts become
 * {@link GitHubTransportException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private final HttpClient httpClient;

	private final GitHubProperties properties;

	public GitHubHttpClient(GitHubProperties properties) {
		this.properties = properties;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(properties.getTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.sslContext(SslContextFactory.create(properties))
			.build();
	}

	@Override
	public String get(String path, Map<String, String> queryParameters) {
		String url = properties.getApiBase() + path + toQueryString(queryParameters);
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(properties.getTimeout())
			.header("Accept", "application/vnd.github+json")
			.header("User-Agent", properties.getUserAgent())
			.GET();
		if (properties.hasToken()) {
			builder.header("Authorization", "Bearer " + properties.getToken());
		}

		try {
			String response = executeRequest(builder.build());
			logger.debug("GET {} completed in {}ms ({} chars)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request,
					HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			if (remaining >= 0 && remaining < 100) {
				logger.info("Rate limit low: {} requests remaining, resets at epoch {}", remaining,
						response.headers().firstValue("X-RateLimit-Reset").orElse("unknown"));
			}

			int statusCode = response.statusCode();
			if (statusCode >= 400) {
				throw new GitHubApiException(statusCode, response.body());
			}
			return response.body();
		}
		catch (IOException e) {
			throw new GitHubTransportException("HTTP request failed: " + describe(e), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubTransportException("HTTP request interrupted", e);
		}
	}

	static String toQueryString(Map<String, String> queryParameters) {
		if (queryParameters.isEmpty()) {
			return "";
		}
		StringJoiner joiner = new StringJoiner("&", "?", "");
		queryParameters.forEach((name, value) -> joiner
			.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
		return joiner.toString();
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static String describe(IOException e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

}
