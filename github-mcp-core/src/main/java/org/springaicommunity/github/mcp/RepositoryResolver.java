package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Determines which repository a tool call addresses.
 *
 * <p>
 * An explicit identifier always wins and is reported precisely when malformed. Otherwise
 * the repository is inferred from the git metadata of a local working copy (the given
 * root, or the working directory). Inference never runs git; it reads
 * {@code .git/config} directly. Nothing is cached between calls.
 */
public class RepositoryResolver {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryResolver.class);

	static final String CANNOT_RESOLVE_MESSAGE = "Cannot resolve repo: provide 'repo' parameter or run inside a git repository";

	private final Path workingDirectory;

	public RepositoryResolver() {
		this(Path.of("").toAbsolutePath());
	}

	public RepositoryResolver(Path workingDirectory) {
		this.workingDirectory = workingDirectory;
	}

	/**
	 * Resolve the repository for a call.
	 * @param explicitIdentifier {@code owner/name}, SSH remote or URL; ignored when blank
	 * @param rootPath local directory to infer from; the working directory when blank
	 * @return the canonical identifier
	 * @throws RepositoryResolutionException if the explicit value is malformed or nothing
	 * could be inferred
	 */
	public RepoIdentifier resolve(@Nullable String explicitIdentifier, @Nullable String rootPath) {
		if (explicitIdentifier != null && !explicitIdentifier.isBlank()) {
			return RepoIdentifierParser.parse(explicitIdentifier);
		}

		Optional<Path> root = (rootPath == null || rootPath.isBlank()) ? Optional.of(workingDirectory)
				: cleanPath(rootPath);
		return root.flatMap(this::inferFromLocalCheckout)
			.orElseThrow(() -> new RepositoryResolutionException(CANNOT_RESOLVE_MESSAGE));
	}

	/**
	 * Infer the repository from the {@code origin} remote (or the first remote) of the
	 * working copy containing {@code root}.
	 * @param root any directory inside the working copy
	 * @return the identifier, or empty when nothing usable was found
	 */
	public Optional<RepoIdentifier> inferFromLocalCheckout(Path root) {
		if (!Files.exists(root)) {
			logger.debug("Root path {} does not exist", root);
			return Optional.empty();
		}

		Optional<Path> gitDir = GitMetadataLocator.locate(root);
		if (gitDir.isEmpty()) {
			logger.debug("No git metadata found above {}", root);
			return Optional.empty();
		}

		Path config = gitDir.get().resolve("config");
		if (!Files.isRegularFile(config)) {
			logger.debug("No config file in {}", gitDir.get());
			return Optional.empty();
		}

		String configText;
		try {
			configText = GitMetadataLocator.readLenient(config);
		}
		catch (IOException e) {
			logger.debug("Unable to read {}: {}", config, e.getMessage());
			return Optional.empty();
		}

		Optional<RemoteEntry> remote = GitConfigParser.findRemote(configText);
		if (remote.isEmpty()) {
			logger.debug("No remote url in {}", config);
			return Optional.empty();
		}
		if (!GitConfigParser.DEFAULT_REMOTE.equalsIgnoreCase(remote.get().remoteName())) {
			logger.info("No '{}' remote in {}, using '{}'", GitConfigParser.DEFAULT_REMOTE, config,
					remote.get().remoteName());
		}

		try {
			RepoIdentifier repo = RepoIdentifierParser.parse(remote.get().url());
			logger.debug("Inferred {} from remote '{}' in {}", repo, remote.get().remoteName(), config);
			return Optional.of(repo);
		}
		catch (RepositoryResolutionException e) {
			logger.debug("Remote url '{}' is not a GitHub repository", remote.get().url());
			return Optional.empty();
		}
	}

	private Optional<Path> cleanPath(String rootPath) {
		try {
			Path path = Path.of(RepoIdentifierParser.stripQuotes(rootPath.trim()));
			return Optional.of(workingDirectory.resolve(path).normalize());
		}
		catch (InvalidPathException e) {
			logger.debug("Invalid root path '{}'", rootPath);
			return Optional.empty();
		}
	}

}
