package org.springaicommunity.github.mcp;

/**
 * Thrown when no usable repository identifier could be determined, either because an
 * explicit value is malformed or because nothing could be inferred from a local checkout.
 */
public class RepositoryResolutionException extends RuntimeException {

	public RepositoryResolutionException(String message) {
		super(message);
	}

}
