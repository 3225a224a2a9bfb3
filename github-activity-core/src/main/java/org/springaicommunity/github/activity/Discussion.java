package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A GitHub discussion with its comments.
 *
 * @param number the discussion number within the repository
 * @param title the discussion title
 * @param url the web URL of the discussion
 * @param body the discussion body (may be null)
 * @param categoryName the name of the discussion category
 * @param createdAt when the discussion was created
 * @param updatedAt when the discussion was last updated
 * @param closedAt when the discussion was closed (null if still open)
 * @param comments top-level comments on the discussion
 */
public record Discussion(int number, String title, String url, @Nullable String body, String categoryName,
		LocalDateTime createdAt, LocalDateTime updatedAt, @Nullable LocalDateTime closedAt,
		List<Comment> comments) implements Item {

	public Discussion {
		comments = List.copyOf(comments);
	}

	@Override
	public ItemCategory category() {
		return ItemCategory.DISCUSSION;
	}

}
