package org.springaicommunity.github.activity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CachingGitHubClient}.
 */
@DisplayName("CachingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class CachingGitHubClientTest {

	private static final String QUERY = "{\"query\":\"query { viewer { login } }\"}";

	private static final String DATA = "{\"data\":{\"viewer\":{\"login\":\"octocat\"}}}";

	@Mock
	private GitHubClient mockDelegate;

	private static String query(String name) {
		return "{\"query\":\"query { " + name + " }\"}";
	}

	@Test
	@DisplayName("Should answer repeated requests from the cache")
	void shouldMemoizeResponses() {
		CachingGitHubClient client = new CachingGitHubClient(mockDelegate);
		when(mockDelegate.postGraphQL(QUERY)).thenReturn(DATA);

		assertThat(client.postGraphQL(QUERY)).isEqualTo(DATA);
		assertThat(client.postGraphQL(QUERY)).isEqualTo(DATA);

		verify(mockDelegate, times(1)).postGraphQL(QUERY);
		assertThat(client.getHits()).isEqualTo(1);
		assertThat(client.getMisses()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should evict the least recently used entry")
	void shouldEvictLeastRecentlyUsed() {
		CachingGitHubClient client = new CachingGitHubClient(mockDelegate, 2);
		when(mockDelegate.postGraphQL(anyString())).thenReturn(DATA);

		client.postGraphQL(query("a"));
		client.postGraphQL(query("b"));
		client.postGraphQL(query("a"));
		client.postGraphQL(query("c"));
		client.postGraphQL(query("a"));
		client.postGraphQL(query("b"));

		assertThat(client.size()).isEqualTo(2);
		verify(mockDelegate, times(1)).postGraphQL(query("a"));
		verify(mockDelegate, times(2)).postGraphQL(query("b"));
	}

	@Test
	@DisplayName("Should not cache transport failures")
	void shouldNotCacheFailures() {
		CachingGitHubClient client = new CachingGitHubClient(mockDelegate);
		when(mockDelegate.postGraphQL(QUERY)).thenThrow(new GitHubHttpClient.GitHubApiException("boom", 502, null))
			.thenReturn(DATA);

		assertThatThrownBy(() -> client.postGraphQL(QUERY)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		assertThat(client.postGraphQL(QUERY)).isEqualTo(DATA);
		assertThat(client.size()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should retry a query whose response carried GraphQL errors")
	void shouldNotCacheGraphQLErrors() {
		when(mockDelegate.postGraphQL(anyString()))
			.thenReturn("{\"errors\":[{\"message\":\"Something went wrong\"}]}")
			.thenReturn(DATA);
		GitHubGraphQLService graphQLService = new GitHubGraphQLService(new CachingGitHubClient(mockDelegate),
				ObjectMapperFactory.create());

		assertThatThrownBy(() -> graphQLService.execute("{ viewer { login } }", Map.of()))
			.isInstanceOf(QueryException.class)
			.hasMessageContaining("Something went wrong");
		assertThat(graphQLService.execute("{ viewer { login } }", Map.of()).path("viewer").path("login").asText())
			.isEqualTo("octocat");

		verify(mockDelegate, times(2)).postGraphQL(anyString());
	}

	@Test
	@DisplayName("Should not cache a response without data")
	void shouldNotCacheResponseWithoutData() {
		CachingGitHubClient client = new CachingGitHubClient(mockDelegate);
		when(mockDelegate.postGraphQL(QUERY)).thenReturn("{\"data\":null}").thenReturn(DATA);

		client.postGraphQL(QUERY);

		assertThat(client.postGraphQL(QUERY)).isEqualTo(DATA);
		assertThat(client.size()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should always send mutations to the delegate")
	void shouldNotCacheMutations() {
		String mutation = "{\"query\":\"mutation CreateDiscussion($input: CreateDiscussionInput!) { id }\"}";
		CachingGitHubClient client = new CachingGitHubClient(mockDelegate);
		when(mockDelegate.postGraphQL(mutation)).thenReturn("{\"data\":{\"createDiscussion\":{\"id\":\"D_1\"}}}")
			.thenReturn("{\"data\":{\"createDiscussion\":{\"id\":\"D_2\"}}}");

		assertThat(client.postGraphQL(mutation)).contains("D_1");
		assertThat(client.postGraphQL(mutation)).contains("D_2");

		assertThat(client.size()).isZero();
		assertThat(client.getMisses()).isZero();
	}

	@Test
	@DisplayName("Should reject a non-positive size")
	void shouldRejectNonPositiveSize() {
		assertThatThrownBy(() -> new CachingGitHubClient(mockDelegate, 0)).isInstanceOf(IllegalArgumentException.class);
	}

}
