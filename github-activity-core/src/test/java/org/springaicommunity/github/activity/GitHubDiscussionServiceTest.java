package org.springaicommunity.github.activity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GitHubDiscussionService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubDiscussionServiceTest {

	private static final RepositoryRef REPO = new RepositoryRef("owner", "repo");

	@Mock
	private GitHubClient httpClient;

	private GitHubDiscussionService discussionService;

	@BeforeEach
	void setUp() {
		discussionService = new GitHubDiscussionService(
				new GitHubGraphQLService(httpClient, ObjectMapperFactory.create()));
	}

	@Test
	@DisplayName("Should find a category by name ignoring case")
	void shouldFindCategoryIgnoringCase() {
		when(httpClient.postGraphQL(anyString())).thenReturn("""
				{
				    "data": {
				        "repository": {
				            "discussionCategories": {
				                "nodes": [
				                    {"id": "DIC_general", "name": "General"},
				                    {"id": "DIC_reports", "name": "Activity Reports"}
				                ]
				            }
				        }
				    }
				}
				""");

		assertThat(discussionService.findCategoryId(REPO, "activity reports")).contains("DIC_reports");
		assertThat(discussionService.findCategoryId(REPO, "Announcements")).isEmpty();
	}

	@Test
	@DisplayName("Should read recent discussions and normalize line endings")
	void shouldReadRecentDiscussions() {
		when(httpClient.postGraphQL(anyString())).thenReturn("""
				{
				    "data": {
				        "repository": {
				            "discussions": {
				                "nodes": [
				                    {"title": "Week 2", "body": "line1\\r\\nline2", "createdAt": "2024-01-15T00:00:00Z"},
				                    {"title": "Undated", "body": "x", "createdAt": null}
				                ]
				            }
				        }
				    }
				}
				""");

		List<DiscussionPost> posts = discussionService.getRecentDiscussions(REPO, "DIC_reports", 3);

		assertThat(posts).singleElement().satisfies(post -> {
			assertThat(post.title()).isEqualTo("Week 2");
			assertThat(post.body()).isEqualTo("line1\nline2");
		});
		ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
		verify(httpClient).postGraphQL(body.capture());
		assertThat(body.getValue()).contains("\"categoryId\":\"DIC_reports\"").contains("\"count\":3");
	}

	@Test
	@DisplayName("Should create a category with description and emoji")
	void shouldCreateCategory() {
		when(httpClient.postGraphQL(anyString())).thenReturn("""
				{"data": {"createDiscussionCategory": {"category": {"id": "DIC_new"}}}}
				""");

		String id = discussionService.createCategory("R_1", "Reports");

		assertThat(id).isEqualTo("DIC_new");
		ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
		verify(httpClient).postGraphQL(body.capture());
		assertThat(body.getValue()).contains("\"description\":\"Category for Reports\"")
			.contains("\"emoji\":\":speech_balloon:\"")
			.contains("\"repositoryId\":\"R_1\"");
	}

	@Test
	@DisplayName("Should create a discussion and return its URL")
	void shouldCreateDiscussion() {
		when(httpClient.postGraphQL(anyString())).thenReturn("""
				{"data": {"createDiscussion": {"discussion": {"id": "D_1", "url": "https://github.com/owner/repo/discussions/9"}}}}
				""");

		assertThat(discussionService.createDiscussion("R_1", "DIC_1", "Title", "Body"))
			.isEqualTo("https://github.com/owner/repo/discussions/9");
	}

	@Test
	@DisplayName("Should fail when the mutation returns no discussion")
	void shouldFailWithoutDiscussion() {
		when(httpClient.postGraphQL(anyString())).thenReturn("""
				{"data": {"createDiscussion": null}}
				""");

		assertThatThrownBy(() -> discussionService.createDiscussion("R_1", "DIC_1", "Title", "Body"))
			.isInstanceOf(QueryException.class);
	}

}
