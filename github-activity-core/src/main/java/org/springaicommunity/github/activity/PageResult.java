package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a cursor-paginated GraphQL connection.
 *
 * @param <T> the type of items in the page
 * @param items the items of this page, in API order
 * @param endCursor cursor for fetching the next page (null if no more pages)
 * @param hasNextPage whether the API reports more pages
 */
public record PageResult<T>(List<T> items, @Nullable String endCursor, boolean hasNextPage) {

	public PageResult {
		items = List.copyOf(items);
	}

	/**
	 * Create an empty result with no more pages.
	 * @param <T> the item type
	 * @return empty PageResult
	 */
	public static <T> PageResult<T> empty() {
		return new PageResult<>(List.of(), null, false);
	}

}
