package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

/**
 * Read access to a repository's identity and its paginated item streams.
 */
public interface ActivityService {

	/**
	 * Resolve a repository.
	 * @param repository the repository to look up
	 * @return repository information
	 * @throws QueryException if the query fails or the repository does not exist
	 */
	RepositoryInfo getRepository(RepositoryRef repository);

	/**
	 * Fetch one page of items of a category, most recently updated first (releases most
	 * recently created first).
	 * @param repository the repository
	 * @param category the item category
	 * @param after cursor of the previous page, null for the first page
	 * @return items of the page with pagination info; items that cannot be parsed are
	 * left out
	 * @throws QueryException if the query fails
	 */
	PageResult<Item> fetchItems(RepositoryRef repository, ItemCategory category, @Nullable String after);

}
