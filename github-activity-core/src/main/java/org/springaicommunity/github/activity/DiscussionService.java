package org.springaicommunity.github.activity;

import java.util.List;
import java.util.Optional;

/**
 * GitHub Discussions operations used for continuation and publishing.
 */
public interface DiscussionService {

	/**
	 * Look up a discussion category by name, ignoring case.
	 * @param repository the repository
	 * @param categoryName the category name
	 * @return the category node ID, or empty if the repository has no such category
	 * @throws QueryException if the query fails
	 */
	Optional<String> findCategoryId(RepositoryRef repository, String categoryName);

	/**
	 * Fetch the most recently updated discussions of a category.
	 * @param repository the repository
	 * @param categoryId the category node ID
	 * @param count maximum number of discussions
	 * @return discussions, most recently updated first
	 * @throws QueryException if the query fails
	 */
	List<DiscussionPost> getRecentDiscussions(RepositoryRef repository, String categoryId, int count);

	/**
	 * Create a discussion category.
	 * @param repositoryId the repository node ID
	 * @param categoryName the category name
	 * @return the new category node ID
	 * @throws QueryException if the mutation fails
	 */
	String createCategory(String repositoryId, String categoryName);

	/**
	 * Create a discussion.
	 * @param repositoryId the repository node ID
	 * @param categoryId the category node ID
	 * @param title the discussion title
	 * @param body the discussion body in Markdown
	 * @return the web URL of the new discussion
	 * @throws QueryException if the mutation fails
	 */
	String createDiscussion(String repositoryId, String categoryId, String title, String body);

}
