package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DiscussionService} backed by the GitHub GraphQL API.
 */
public class GitHubDiscussionService implements DiscussionService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubDiscussionService.class);

	private static final String CATEGORIES_QUERY = """
			query($owner: String!, $name: String!) {
			    repository(owner: $owner, name: $name) {
			        discussionCategories(first: 100) {
			            nodes {
			                id
			                name
			            }
			        }
			    }
			}
			""";

	private static final String RECENT_DISCUSSIONS_QUERY = """
			query($owner: String!, $name: String!, $categoryId: ID!, $count: Int!) {
			    repository(owner: $owner, name: $name) {
			        discussions(first: $count, categoryId: $categoryId, orderBy: {field: UPDATED_AT, direction: DESC}) {
			            nodes {
			                title
			                body
			                createdAt
			                updatedAt
			            }
			        }
			    }
			}
			""";

	private static final String CREATE_CATEGORY_MUTATION = """
			mutation CreateDiscussionCategory($input: CreateDiscussionCategoryInput!) {
			    createDiscussionCategory(input: $input) {
			        category {
			            id
			        }
			    }
			}
			""";

	private static final String CREATE_DISCUSSION_MUTATION = """
			mutation CreateDiscussion($input: CreateDiscussionInput!) {
			    createDiscussion(input: $input) {
			        discussion {
			            id
			            url
			        }
			    }
			}
			""";

	private final GraphQLService graphQLService;

	public GitHubDiscussionService(GraphQLService graphQLService) {
		this.graphQLService = graphQLService;
	}

	@Override
	public Optional<String> findCategoryId(RepositoryRef repository, String categoryName) {
		JsonNode nodes = graphQLService
			.execute(CATEGORIES_QUERY, Map.of("owner", repository.owner(), "name", repository.name()))
			.path("repository")
			.path("discussionCategories")
			.path("nodes");
		for (JsonNode node : nodes) {
			if (node.path("name").asText("").equalsIgnoreCase(categoryName)) {
				return Optional.of(node.path("id").asText());
			}
		}
		return Optional.empty();
	}

	@Override
	public List<DiscussionPost> getRecentDiscussions(RepositoryRef repository, String categoryId, int count) {
		JsonNode nodes = graphQLService
			.execute(RECENT_DISCUSSIONS_QUERY,
					Map.of("owner", repository.owner(), "name", repository.name(), "categoryId", categoryId, "count",
							count))
			.path("repository")
			.path("discussions")
			.path("nodes");

		List<DiscussionPost> posts = new ArrayList<>();
		for (JsonNode node : nodes) {
			try {
				posts.add(new DiscussionPost(node.path("title").asText(""),
						node.path("body").asText("").replace("\r\n", "\n"),
						GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt")));
			}
			catch (DateTimeParseException e) {
				logger.warn("Skipping discussion '{}': {}", node.path("title").asText(""), e.getMessage());
			}
		}
		return posts;
	}

	@Override
	public String createCategory(String repositoryId, String categoryName) {
		Map<String, Object> input = Map.of("repositoryId", repositoryId, "name", categoryName, "description",
				"Category for " + categoryName, "emoji", ":speech_balloon:");
		JsonNode category = graphQLService.execute(CREATE_CATEGORY_MUTATION, Map.of("input", input))
			.path("createDiscussionCategory")
			.path("category");
		if (!category.hasNonNull("id")) {
			throw new QueryException("Category '" + categoryName + "' was not created");
		}
		return category.path("id").asText();
	}

	@Override
	public String createDiscussion(String repositoryId, String categoryId, String title, String body) {
		Map<String, Object> input = Map.of("repositoryId", repositoryId, "categoryId", categoryId, "title", title,
				"body", body);
		JsonNode discussion = graphQLService.execute(CREATE_DISCUSSION_MUTATION, Map.of("input", input))
			.path("createDiscussion")
			.path("discussion");
		if (!discussion.hasNonNull("url")) {
			throw new QueryException("Discussion '" + title + "' was not created");
		}
		return discussion.path("url").asText();
	}

}
