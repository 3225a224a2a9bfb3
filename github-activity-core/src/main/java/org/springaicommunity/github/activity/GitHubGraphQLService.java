package org.springaicommunity.github.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes GraphQL documents against GitHub through a {@link GitHubClient}.
 *
 * <p>
 * Variables are serialized with their keys in sorted order so that identical queries
 * always produce identical request bodies, which is what {@link CachingGitHubClient} keys
 * on.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final ObjectWriter requestWriter;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.requestWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
	}

	@Override
	public JsonNode execute(String query, Map<String, ?> variables) {
		String requestBody = buildRequestBody(query, variables);

		String response;
		try {
			response = httpClient.postGraphQL(requestBody);
		}
		catch (RuntimeException e) {
			throw new QueryException("GraphQL request failed: " + e.getMessage(), e);
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new QueryException("GraphQL response is not valid JSON: " + e.getOriginalMessage(), e);
		}

		JsonNode errors = root.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			List<String> messages = new ArrayList<>();
			for (JsonNode error : errors) {
				messages.add(error.path("message").asText("unknown error"));
			}
			logger.debug("GraphQL errors: {}", messages);
			throw new QueryException("GraphQL query returned errors: " + String.join("; ", messages));
		}

		JsonNode data = root.path("data");
		if (data.isMissingNode() || data.isNull()) {
			throw new QueryException("GraphQL response has no data");
		}
		return data;
	}

	String buildRequestBody(String query, Map<String, ?> variables) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("query", query);
		request.put("variables", variables);
		try {
			return requestWriter.writeValueAsString(request);
		}
		catch (JsonProcessingException e) {
			throw new QueryException("Failed to serialize GraphQL request: " + e.getOriginalMessage(), e);
		}
	}

}
