package org.springaicommunity.github.activity;

/**
 * Interface for GitHub GraphQL API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub GraphQL endpoint, enabling testability and
 * decorator implementations (caching, logging).
 */
public interface GitHubClient {

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

}
