package org.springaicommunity.github.activity;

import java.time.LocalDateTime;

/**
 * Basic repository information from the GitHub API.
 *
 * @param id the GraphQL node ID of the repository
 * @param nameWithOwner the full repository name in "owner/repo" format
 * @param url the web URL for the repository
 * @param createdAt when the repository was created (UTC)
 */
public record RepositoryInfo(String id, String nameWithOwner, String url, LocalDateTime createdAt) {
}
