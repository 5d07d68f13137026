package org.springaicommunity.github.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the git metadata directory for a working copy by walking up from a start
 * directory.
 *
 * <p>
 * A {@code .git} directory is returned as is. A {@code .git} file is treated as a
 * worktree pointer ({@code gitdir: <path>}); relative pointers resolve against the
 * directory holding the file. Discovery is best-effort: I/O failures end the search with
 * an empty result.
 */
public final class GitMetadataLocator {

	private static final Logger logger = LoggerFactory.getLogger(GitMetadataLocator.class);

	private static final String GITDIR_PREFIX = "gitdir:";

	private GitMetadataLocator() {
	}

	/**
	 * Locate the metadata directory for {@code start} or any of its ancestors.
	 * @param start directory to begin the search in (inclusive)
	 * @return the directory containing the repository's {@code config}, if found
	 */
	public static Optional<Path> locate(Path start) {
		Path current = start.toAbsolutePath().normalize();
		while (current != null) {
			Path gitPath = current.resolve(".git");
			if (Files.isDirectory(gitPath)) {
				return Optional.of(gitPath);
			}
			if (Files.isRegularFile(gitPath)) {
				String content;
				try {
					content = readLenient(gitPath).strip();
				}
				catch (IOException e) {
					logger.debug("Unable to read worktree pointer {}: {}", gitPath, e.getMessage());
					return Optional.empty();
				}
				if (content.toLowerCase(Locale.ROOT).startsWith(GITDIR_PREFIX)) {
					return resolvePointer(current, content.substring(GITDIR_PREFIX.length()).strip());
				}
			}
			current = current.getParent();
		}
		return Optional.empty();
	}

	private static Optional<Path> resolvePointer(Path directory, String target) {
		try {
			Path gitDir = directory.resolve(target).normalize();
			if (Files.exists(gitDir)) {
				return Optional.of(gitDir);
			}
			logger.debug("Worktree pointer in {} refers to missing directory {}", directory, gitDir);
		}
		catch (InvalidPathException e) {
			logger.debug("Invalid worktree pointer '{}' in {}", target, directory);
		}
		return Optional.empty();
	}

	/**
	 * Read a text file as UTF-8, replacing malformed input instead of failing.
	 */
	static String readLenient(Path file) throws IOException {
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

}
