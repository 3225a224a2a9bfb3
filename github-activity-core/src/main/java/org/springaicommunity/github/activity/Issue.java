package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A GitHub issue with its comments.
 *
 * @param number the issue number within the repository
 * @param title the issue title
 * @param url the web URL of the issue
 * @param body the issue description (may be null)
 * @param state the issue state ("OPEN" or "CLOSED")
 * @param createdAt when the issue was created
 * @param updatedAt when the issue was last updated
 * @param closedAt when the issue was closed (null if still open)
 * @param comments comments on the issue
 */
public record Issue(int number, String title, String url, @Nullable String body, String state,
		LocalDateTime createdAt, LocalDateTime updatedAt, @Nullable LocalDateTime closedAt,
		List<Comment> comments) implements Item {

	public Issue {
		comments = List.copyOf(comments);
	}

	@Override
	public ItemCategory category() {
		return ItemCategory.ISSUE;
	}

}
