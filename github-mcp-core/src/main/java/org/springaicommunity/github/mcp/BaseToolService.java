package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class for tool services providing repository resolution and the error boundary
 * shared by every tool.
 *
 * <p>
 * A tool body receives the resolved {@link RepoIdentifier} and builds its result. Any
 * runtime failure, whether resolution, upstream status, transport or argument validation,
 * is converted into a {@link ToolError}; nothing propagates to the transport.
 */
public abstract class BaseToolService {

	private static final Logger logger = LoggerFactory.getLogger(BaseToolService.class);

	private static final Set<String> STATES = Set.of("open", "closed", "all");

	/**
	 * Budget for one-line text fields: titles, names, commit subjects.
	 */
	static final int MAX_TITLE_CHARS = 500;

	/**
	 * Cap for name lists such as labels, assignees and topics.
	 */
	static final int MAX_NAMES = 100;

	protected final RepositoryResolver repositoryResolver;

	protected final RestService restService;

	protected BaseToolService(RepositoryResolver repositoryResolver, RestService restService) {
		this.repositoryResolver = repositoryResolver;
		this.restService = restService;
	}

	/**
	 * Resolve the repository and run {@code body}, converting failures into a
	 * {@link ToolError} for {@code toolName}.
	 */
	protected ToolResponse execute(String toolName, @Nullable String repo, @Nullable String rootPath,
			Function<RepoIdentifier, ToolResponse> body) {
		try {
			RepoIdentifier resolved = repositoryResolver.resolve(repo, rootPath);
			logger.debug("{} resolved repository {}", toolName, resolved);
			return body.apply(resolved);
		}
		catch (RuntimeException e) {
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			logger.warn("{} failed: {}", toolName, message);
			return new ToolError(message, toolName);
		}
	}

	/**
	 * Require a non-blank argument.
	 * @return the stripped value
	 * @throws IllegalArgumentException if the value is blank
	 */
	protected static String require(@Nullable String value, String argumentName) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(argumentName + " is required");
		}
		return value.strip();
	}

	/**
	 * Normalize an issue/PR state filter, defaulting to {@code open}.
	 */
	protected static String state(@Nullable String value) {
		String state = (value == null || value.isBlank()) ? "open" : value.strip().toLowerCase(Locale.ROOT);
		if (!STATES.contains(state)) {
			throw new IllegalArgumentException("state must be one of open, closed, all");
		}
		return state;
	}

	/**
	 * Truncate a title-like field at {@link #MAX_TITLE_CHARS}.
	 */
	@Nullable
	protected static String title(@Nullable String value) {
		return value == null ? null : ResponseShaping.truncateText(value, MAX_TITLE_CHARS).text();
	}

	/**
	 * Keep at most {@link #MAX_NAMES} names, each truncated like a title.
	 */
	protected static List<String> names(List<String> values) {
		return ResponseShaping.capList(values, MAX_NAMES)
			.items()
			.stream()
			.map(name -> ResponseShaping.truncateText(name, MAX_TITLE_CHARS).text())
			.toList();
	}

	@Nullable
	protected static String blankToNull(@Nullable String value) {
		return (value == null || value.isBlank()) ? null : value.strip();
	}

}
