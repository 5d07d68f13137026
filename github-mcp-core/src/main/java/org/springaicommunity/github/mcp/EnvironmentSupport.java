package org.springaicommunity.github.mcp;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Set;

/**
 * Resolves configuration variables by checking a {@code .env} file first, then falling
 * back to the system environment. The {@code .env} files are loaded once and cached for
 * the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no");

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not set or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return (value == null || value.isBlank()) ? null : value.trim();
	}

	/**
	 * Get a variable value with a fallback.
	 */
	public static String get(String name, String defaultValue) {
		String value = get(name);
		return value != null ? value : defaultValue;
	}

	/**
	 * Interpret a flag variable. Anything other than {@code false}, {@code 0} or {@code no}
	 * (case-insensitive) counts as enabled.
	 */
	public static boolean isEnabled(String name, boolean defaultValue) {
		String value = get(name);
		return value == null ? defaultValue : isEnabledValue(value);
	}

	static boolean isEnabledValue(String value) {
		return !FALSE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
	}

}
