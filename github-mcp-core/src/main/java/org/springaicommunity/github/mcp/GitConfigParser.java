package org.springaicommunity.github.mcp;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented reader for the remote sections of a git {@code config} file.
 *
 * <p>
 * Only {@code url} keys inside {@code [remote "..."]} sections are considered. Everything
 * else (other sections, comments, keys before the first header) is skipped.
 */
public final class GitConfigParser {

	public static final String DEFAULT_REMOTE = "origin";

	private static final Pattern REMOTE_HEADER = Pattern.compile("\\[remote\\s+\"([^\"]+)\"\\]",
			Pattern.CASE_INSENSITIVE);

	private GitConfigParser() {
	}

	/**
	 * Find the url of {@code remoteName}, falling back to the first remote section (in file
	 * order) that declares a url.
	 * @param configText full text of the configuration file
	 * @param remoteName preferred remote, matched case-insensitively
	 * @return the matching remote, or empty when no remote section carries a url
	 */
	public static Optional<RemoteEntry> findRemote(String configText, String remoteName) {
		List<String> lines = configText.lines().map(String::strip).toList();

		String targetHeader = ("[remote \"" + remoteName + "\"]").toLowerCase(Locale.ROOT);
		boolean inTarget = false;
		for (String line : lines) {
			if (isSectionHeader(line)) {
				inTarget = line.toLowerCase(Locale.ROOT).equals(targetHeader);
				continue;
			}
			if (inTarget) {
				Optional<String> url = urlValue(line);
				if (url.isPresent()) {
					return Optional.of(new RemoteEntry(remoteName, url.get()));
				}
			}
		}

		String currentRemote = null;
		for (String line : lines) {
			if (isSectionHeader(line)) {
				Matcher matcher = REMOTE_HEADER.matcher(line);
				currentRemote = matcher.matches() ? matcher.group(1) : null;
				continue;
			}
			if (currentRemote != null) {
				Optional<String> url = urlValue(line);
				if (url.isPresent()) {
					return Optional.of(new RemoteEntry(currentRemote, url.get()));
				}
			}
		}

		return Optional.empty();
	}

	/**
	 * Shorthand for {@link #findRemote(String, String)} with {@value #DEFAULT_REMOTE}.
	 */
	public static Optional<RemoteEntry> findRemote(String configText) {
		return findRemote(configText, DEFAULT_REMOTE);
	}

	private static boolean isSectionHeader(String line) {
		return line.startsWith("[") && line.endsWith("]");
	}

	private static Optional<String> urlValue(String line) {
		if (line.startsWith("#") || line.startsWith(";")) {
			return Optional.empty();
		}
		int eq = line.indexOf('=');
		if (eq < 0) {
			return Optional.empty();
		}
		String key = line.substring(0, eq).strip();
		if (!key.equalsIgnoreCase("url")) {
			return Optional.empty();
		}
		return Optional.of(line.substring(eq + 1).strip());
	}

}
