package org.springaicommunity.github.mcp;

/**
 * A remote section of a git configuration file together with its {@code url} value.
 *
 * @param remoteName the name in the section header, e.g. {@code origin}
 * @param url the raw url value, whitespace-trimmed
 */
public record RemoteEntry(String remoteName, String url) {

}
