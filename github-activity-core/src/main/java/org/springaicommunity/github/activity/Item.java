package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A repository item fetched from GitHub: a pull request, issue, release or discussion.
 *
 * <p>
 * Items are read-only snapshots taken during a single run. All timestamps are UTC.
 * Variant-specific data (merge state, commits, tag names) is reached by switching on
 * {@link #category()}.
 */
public sealed interface Item permits PullRequest, Issue, Release, Discussion {

	ItemCategory category();

	String title();

	String url();

	@Nullable
	String body();

	LocalDateTime createdAt();

	LocalDateTime updatedAt();

	/**
	 * When the item was closed.
	 * @return close timestamp, or null for open items and items that cannot be closed
	 */
	default @Nullable LocalDateTime closedAt() {
		return null;
	}

	/**
	 * Comments on the item, as fetched with it.
	 * @return comments, empty for items without comments
	 */
	default List<Comment> comments() {
		return List.of();
	}

}
