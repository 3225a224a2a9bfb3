package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for wiring the activity aggregation services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN
 * ActivityAggregationService service = GitHubActivityBuilder.create()
 *     .tokenFromEnv()
 *     .buildAggregationService();
 *
 * // With custom configuration
 * ActivityProperties props = new ActivityProperties();
 * props.setWindowStepDays(14);
 * props.setCacheEnabled(true);
 *
 * ActivityAggregationService service = GitHubActivityBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildAggregationService();
 *
 * ActivityReport report = service.aggregate(RepositoryRef.parse("owner/repo"), "Activity", null);
 *
 * // For testing with a mock client and a fixed day
 * GitHubClient mockClient = mock(GitHubClient.class);
 * ActivityAggregationService testService = GitHubActivityBuilder.create()
 *     .httpClient(mockClient)
 *     .clock(Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC))
 *     .buildAggregationService();
 * }
 * </pre>
 */
public class GitHubActivityBuilder {

	private @Nullable String token;

	private ActivityProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private Clock clock;

	private @Nullable GraphQLService graphQLService;

	private GitHubActivityBuilder() {
		this.properties = new ActivityProperties();
		this.clock = Clock.systemUTC();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubActivityBuilder
	 */
	public static GitHubActivityBuilder create() {
		return new GitHubActivityBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubActivityBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}, looked up through
	 * {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubActivityBuilder tokenFromEnv() {
		String value = EnvironmentSupport.get("GITHUB_TOKEN");
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		this.token = value;
		return this;
	}

	/**
	 * Set activity properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubActivityBuilder properties(@Nullable ActivityProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubActivityBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required. The client is still
	 * wrapped in a {@link CachingGitHubClient} when caching is enabled.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubActivityBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock that decides what "today" is.
	 * @param clock clock (null to use the UTC system clock)
	 * @return this builder
	 */
	public GitHubActivityBuilder clock(@Nullable Clock clock) {
		this.clock = clock != null ? clock : Clock.systemUTC();
		return this;
	}

	/**
	 * Build the GraphQLService directly (for advanced usage).
	 * @return configured GraphQLService
	 */
	public GraphQLService buildGraphQLService() {
		validateToken();
		return graphQLService();
	}

	/**
	 * Build an ActivityAggregationService.
	 * @return configured ActivityAggregationService
	 */
	public ActivityAggregationService buildAggregationService() {
		validateToken();
		GraphQLService graphQL = graphQLService();
		ActivityService activityService = new GitHubActivityService(graphQL, properties);
		ContinuationResolver continuationResolver = new ContinuationResolver(new GitHubDiscussionService(graphQL),
				properties);
		AdaptiveWindowController controller = new AdaptiveWindowController(
				new ItemStreamFetcher(activityService, properties), properties, clock);
		return new ActivityAggregationService(activityService, continuationResolver, controller);
	}

	/**
	 * Build a DiscussionPublisher.
	 * @return configured DiscussionPublisher
	 */
	public DiscussionPublisher buildDiscussionPublisher() {
		validateToken();
		return new DiscussionPublisher(new GitHubDiscussionService(graphQLService()));
	}

	private void validateToken() {
		// A custom client carries its own credentials
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	/**
	 * The GraphQL service is shared by everything built from this builder so that
	 * aggregation and publishing use one cache.
	 */
	private GraphQLService graphQLService() {
		if (graphQLService == null) {
			ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
			GitHubClient client = this.httpClient != null ? this.httpClient
					: new GitHubHttpClient(token, properties.getGraphqlEndpoint());
			if (properties.isCacheEnabled()) {
				client = new CachingGitHubClient(client, properties.getCacheSize());
			}
			graphQLService = new GitHubGraphQLService(client, mapper);
		}
		return graphQLService;
	}

}
