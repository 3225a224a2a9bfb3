package org.springaicommunity.github.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decorator that memoizes GraphQL responses of a {@link GitHubClient}.
 *
 * <p>
 * Responses are keyed by the exact request body, which holds the query text and its
 * variables. {@link GitHubGraphQLService} serializes variables with sorted keys, so equal
 * queries produce equal keys. Only query responses that carry {@code data} and no
 * GraphQL {@code errors} are stored; mutations always reach the delegate. The least
 * recently used entry is evicted once {@code maxEntries} is reached.
 *
 * <pre>
 * {@code
 * GitHubClient client = new CachingGitHubClient(new GitHubHttpClient(token), 100);
 * }
 * </pre>
 */
public final class CachingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(CachingGitHubClient.class);

	/**
	 * Default number of cached responses.
	 */
	public static final int DEFAULT_MAX_ENTRIES = 100;

	private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

	private final GitHubClient delegate;

	private final Map<String, String> cache;

	private long hits;

	private long misses;

	public CachingGitHubClient(GitHubClient delegate) {
		this(delegate, DEFAULT_MAX_ENTRIES);
	}

	public CachingGitHubClient(GitHubClient delegate, int maxEntries) {
		if (maxEntries <= 0) {
			throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
		}
		this.delegate = delegate;
		this.cache = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
				return size() > maxEntries;
			}
		};
	}

	@Override
	public synchronized String postGraphQL(String body) {
		if (isMutation(body)) {
			return delegate.postGraphQL(body);
		}
		String cached = cache.get(body);
		if (cached != null) {
			hits++;
			logger.debug("Cache hit ({} hits, {} misses)", hits, misses);
			return cached;
		}
		misses++;
		logger.debug("Cache miss ({} hits, {} misses)", hits, misses);
		String response = delegate.postGraphQL(body);
		if (isSuccessful(response)) {
			cache.put(body, response);
		}
		else {
			logger.debug("Not caching a response with GraphQL errors");
		}
		return response;
	}

	private static boolean isMutation(String body) {
		try {
			return MAPPER.readTree(body).path("query").asText("").stripLeading().startsWith("mutation");
		}
		catch (JsonProcessingException e) {
			return false;
		}
	}

	private static boolean isSuccessful(String response) {
		try {
			JsonNode root = MAPPER.readTree(response);
			JsonNode errors = root.path("errors");
			JsonNode data = root.path("data");
			return !(errors.isArray() && !errors.isEmpty()) && !data.isMissingNode() && !data.isNull();
		}
		catch (JsonProcessingException e) {
			return false;
		}
	}

	public synchronized int size() {
		return cache.size();
	}

	public synchronized long getHits() {
		return hits;
	}

	public synchronized long getMisses() {
		return misses;
	}

}
