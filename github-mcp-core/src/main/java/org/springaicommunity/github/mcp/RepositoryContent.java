package org.springaicommunity.github.mcp;

/**
 * Result of the contents API: a {@link DirectoryListing}, a {@link FileContent}, or a
 * {@link ContentEntry} for anything else (symlinks, submodules).
 */
public interface RepositoryContent {

}
