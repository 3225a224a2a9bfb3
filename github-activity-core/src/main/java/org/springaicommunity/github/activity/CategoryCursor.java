package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

/**
 * Pagination state of one item category. Each round of {@link ItemStreamFetcher} replaces
 * the cursor with a new value rather than mutating it.
 *
 * @param category the item category
 * @param after cursor of the last fetched page, null before the first page
 * @param active whether more pages should be requested
 * @param pages number of pages fetched so far
 * @param items number of items kept so far
 */
public record CategoryCursor(ItemCategory category, @Nullable String after, boolean active, int pages, int items) {

	/**
	 * Cursor before the first page of a category.
	 * @param category the item category
	 * @return an active cursor with no pages fetched
	 */
	public static CategoryCursor start(ItemCategory category) {
		return new CategoryCursor(category, null, true, 0, 0);
	}

	/**
	 * Cursor after a page has been consumed.
	 * @param page the fetched page
	 * @param kept number of items kept from the page
	 * @param reachedHorizon whether the page contained an item older than the horizon
	 * @return the next cursor; inactive when the horizon was reached or no pages remain
	 */
	public CategoryCursor advance(PageResult<Item> page, int kept, boolean reachedHorizon) {
		boolean more = page.hasNextPage() && !reachedHorizon;
		return new CategoryCursor(category, page.endCursor(), more, pages + 1, items + kept);
	}

	/**
	 * Cursor for a category that failed and must not be queried again in this run.
	 * @return an inactive copy of this cursor
	 */
	public CategoryCursor disable() {
		return new CategoryCursor(category, after, false, pages, items);
	}

}
