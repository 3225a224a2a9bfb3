package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Interface for GitHub GraphQL API operations.
 *
 * <p>
 * Extracted to enable mocking in tests.
 */
public interface GraphQLService {

	/**
	 * Execute a GraphQL query or mutation with variables.
	 * @param query GraphQL document
	 * @param variables query variables, values may be null
	 * @return the {@code data} node of the response
	 * @throws QueryException if the request fails or the response carries errors
	 */
	JsonNode execute(String query, Map<String, ?> variables);

}
