package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * One item of a directory listing.
 */
public record ContentEntry(@Nullable String type, @Nullable String name, @Nullable String path,
		@Nullable String sha, @Nullable Long size) implements RepositoryContent {

}
