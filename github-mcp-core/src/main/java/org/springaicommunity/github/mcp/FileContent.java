package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * Contents API response for a file.
 *
 * @param path file path in the repository
 * @param sha blob SHA
 * @param size size in bytes
 * @param text decoded content, or {@code null} when GitHub returned no inline content
 * (files over 1MB)
 * @param downloadUrl raw download URL
 * @param htmlUrl web URL
 */
public record FileContent(@Nullable String path, @Nullable String sha, @Nullable Long size, @Nullable String text,
		@Nullable String downloadUrl, @Nullable String htmlUrl) implements RepositoryContent {

}
