package org.springaicommunity.github.mcp;

import java.util.List;

/**
 * Contents API response for a directory.
 */
public record DirectoryListing(List<ContentEntry> entries) implements RepositoryContent {

}
