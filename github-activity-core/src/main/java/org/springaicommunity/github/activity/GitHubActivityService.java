package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ActivityService} backed by the GitHub GraphQL API.
 *
 * <p>
 * Each category has its own query so that a failure in one connection does not affect
 * the others. JSON is converted to the {@link Item} variants here, at the service
 * boundary; an item with a malformed or missing timestamp is logged and skipped.
 */
public class GitHubActivityService implements ActivityService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubActivityService.class);

	private static final String REPOSITORY_QUERY = """
			query($owner: String!, $name: String!) {
			    repository(owner: $owner, name: $name) {
			        id
			        nameWithOwner
			        url
			        createdAt
			    }
			}
			""";

	private static final String PULL_REQUESTS_QUERY = """
			query($owner: String!, $name: String!, $first: Int!, $nested: Int!, $after: String) {
			    repository(owner: $owner, name: $name) {
			        pullRequests(first: $first, after: $after, orderBy: {field: UPDATED_AT, direction: DESC}) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                number
			                title
			                url
			                body
			                state
			                createdAt
			                updatedAt
			                merged
			                mergedAt
			                closedAt
			                comments(first: $nested) {
			                    nodes {
			                        createdAt
			                        body
			                        author {
			                            login
			                            ... on User {
			                                name
			                            }
			                        }
			                    }
			                }
			                commits(last: $nested) {
			                    nodes {
			                        commit {
			                            message
			                            committedDate
			                            author {
			                                name
			                            }
			                        }
			                    }
			                }
			            }
			        }
			    }
			}
			""";

	private static final String ISSUES_QUERY = """
			query($owner: String!, $name: String!, $first: Int!, $nested: Int!, $after: String) {
			    repository(owner: $owner, name: $name) {
			        issues(first: $first, after: $after, orderBy: {field: UPDATED_AT, direction: DESC}) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                number
			                title
			                url
			                body
			                state
			                createdAt
			                updatedAt
			                closedAt
			                comments(first: $nested) {
			                    nodes {
			                        createdAt
			                        body
			                        author {
			                            login
			                            ... on User {
			                                name
			                            }
			                        }
			                    }
			                }
			            }
			        }
			    }
			}
			""";

	private static final String RELEASES_QUERY = """
			query($owner: String!, $name: String!, $first: Int!, $after: String) {
			    repository(owner: $owner, name: $name) {
			        releases(first: $first, after: $after, orderBy: {field: CREATED_AT, direction: DESC}) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                name
			                tagName
			                url
			                description
			                createdAt
			            }
			        }
			    }
			}
			""";

	private static final String DISCUSSIONS_QUERY = """
			query($owner: String!, $name: String!, $first: Int!, $nested: Int!, $after: String) {
			    repository(owner: $owner, name: $name) {
			        discussions(first: $first, after: $after, orderBy: {field: UPDATED_AT, direction: DESC}) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                number
			                title
			                url
			                body
			                createdAt
			                updatedAt
			                closedAt
			                category {
			                    name
			                }
			                comments(first: $nested) {
			                    nodes {
			                        createdAt
			                        body
			                        author {
			                            login
			                            ... on User {
			                                name
			                            }
			                        }
			                    }
			                }
			            }
			        }
			    }
			}
			""";

	private final GraphQLService graphQLService;

	private final int pageSize;

	private final int nestedPageSize;

	public GitHubActivityService(GraphQLService graphQLService, ActivityProperties properties) {
		this.graphQLService = graphQLService;
		this.pageSize = properties.getPageSize();
		this.nestedPageSize = properties.getNestedPageSize();
	}

	@Override
	public RepositoryInfo getRepository(RepositoryRef repository) {
		JsonNode node = graphQLService
			.execute(REPOSITORY_QUERY, Map.of("owner", repository.owner(), "name", repository.name()))
			.path("repository");
		if (node.isMissingNode() || node.isNull()) {
			throw new QueryException("Repository not found: " + repository);
		}
		try {
			return new RepositoryInfo(node.path("id").asText(), node.path("nameWithOwner").asText(repository.fullName()),
					node.path("url").asText(""), GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt"));
		}
		catch (DateTimeParseException e) {
			throw new QueryException("Repository " + repository + " has an unreadable creation date", e);
		}
	}

	@Override
	public PageResult<Item> fetchItems(RepositoryRef repository, ItemCategory category, @Nullable String after) {
		Map<String, Object> variables = new HashMap<>();
		variables.put("owner", repository.owner());
		variables.put("name", repository.name());
		variables.put("first", pageSize);
		variables.put("after", after);
		if (category != ItemCategory.RELEASE) {
			variables.put("nested", nestedPageSize);
		}

		JsonNode connection = graphQLService.execute(queryFor(category), variables)
			.path("repository")
			.path(category.connectionName());
		if (connection.isMissingNode() || connection.isNull()) {
			throw new QueryException("Response has no " + category.connectionName() + " for " + repository);
		}

		JsonNode pageInfo = connection.path("pageInfo");
		boolean hasNextPage = pageInfo.path("hasNextPage").asBoolean(false);
		String endCursor = hasNextPage ? pageInfo.path("endCursor").asText(null) : null;

		List<Item> items = new ArrayList<>();
		for (JsonNode node : connection.path("nodes")) {
			Item item = parseItem(category, node);
			if (item != null) {
				items.add(item);
			}
		}
		return new PageResult<>(items, endCursor, hasNextPage && endCursor != null);
	}

	private static String queryFor(ItemCategory category) {
		return switch (category) {
			case PULL_REQUEST -> PULL_REQUESTS_QUERY;
			case ISSUE -> ISSUES_QUERY;
			case RELEASE -> RELEASES_QUERY;
			case DISCUSSION -> DISCUSSIONS_QUERY;
		};
	}

	// ========== JSON Parsing Methods (at service boundary) ==========

	private @Nullable Item parseItem(ItemCategory category, JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return null;
		}
		try {
			return switch (category) {
				case PULL_REQUEST -> parsePullRequest(node);
				case ISSUE -> parseIssue(node);
				case RELEASE -> parseRelease(node);
				case DISCUSSION -> parseDiscussion(node);
			};
		}
		catch (DateTimeParseException e) {
			logger.warn("Skipping {} item {}: {}", category.label().toLowerCase(), describe(node), e.getMessage());
			return null;
		}
	}

	private PullRequest parsePullRequest(JsonNode node) {
		return new PullRequest(node.path("number").asInt(), node.path("title").asText(""), node.path("url").asText(""),
				node.path("body").asText(null), node.path("state").asText(""),
				GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt"),
				GitHubTimestamps.parseRequired(node.path("updatedAt"), "updatedAt"),
				node.path("merged").asBoolean(false), GitHubTimestamps.parseOptional(node.path("mergedAt")),
				GitHubTimestamps.parseOptional(node.path("closedAt")), parseComments(node.path("comments")),
				parseCommits(node.path("commits")));
	}

	private Issue parseIssue(JsonNode node) {
		return new Issue(node.path("number").asInt(), node.path("title").asText(""), node.path("url").asText(""),
				node.path("body").asText(null), node.path("state").asText(""),
				GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt"),
				GitHubTimestamps.parseRequired(node.path("updatedAt"), "updatedAt"),
				GitHubTimestamps.parseOptional(node.path("closedAt")), parseComments(node.path("comments")));
	}

	private Release parseRelease(JsonNode node) {
		return new Release(node.path("name").asText(null), node.path("tagName").asText(""),
				node.path("url").asText(""), node.path("description").asText(null),
				GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt"));
	}

	private Discussion parseDiscussion(JsonNode node) {
		return new Discussion(node.path("number").asInt(), node.path("title").asText(""), node.path("url").asText(""),
				node.path("body").asText(null), node.path("category").path("name").asText(""),
				GitHubTimestamps.parseRequired(node.path("createdAt"), "createdAt"),
				GitHubTimestamps.parseRequired(node.path("updatedAt"), "updatedAt"),
				GitHubTimestamps.parseOptional(node.path("closedAt")), parseComments(node.path("comments")));
	}

	private List<Comment> parseComments(JsonNode connection) {
		List<Comment> comments = new ArrayList<>();
		for (JsonNode node : connection.path("nodes")) {
			comments.add(new Comment(parseAuthor(node.path("author")), node.path("body").asText(""),
					GitHubTimestamps.parseRequired(node.path("createdAt"), "comment createdAt")));
		}
		return comments;
	}

	private List<Commit> parseCommits(JsonNode connection) {
		List<Commit> commits = new ArrayList<>();
		for (JsonNode node : connection.path("nodes")) {
			JsonNode commit = node.path("commit");
			commits.add(new Commit(commit.path("message").asText(""),
					GitHubTimestamps.parseRequired(commit.path("committedDate"), "committedDate"),
					commit.path("author").path("name").asText("unknown")));
		}
		return commits;
	}

	private Author parseAuthor(JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return Author.GHOST;
		}
		return new Author(node.path("login").asText(Author.GHOST.login()), node.path("name").asText(null));
	}

	private static String describe(JsonNode node) {
		if (node.hasNonNull("number")) {
			return "#" + node.path("number").asInt();
		}
		return node.path("tagName").asText("?");
	}

}
