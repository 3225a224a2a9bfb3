package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A GitHub pull request with its comments and commits.
 *
 * @param number the pull request number within the repository
 * @param title the pull request title
 * @param url the web URL of the pull request
 * @param body the description (may be null)
 * @param state the state reported by GitHub ("OPEN", "CLOSED" or "MERGED")
 * @param createdAt when the pull request was created
 * @param updatedAt when the pull request was last updated
 * @param merged whether the pull request has been merged
 * @param mergedAt when the pull request was merged (null if not merged)
 * @param closedAt when the pull request was closed (null if still open)
 * @param comments comments on the pull request
 * @param commits the most recent commits of the pull request
 */
public record PullRequest(int number, String title, String url, @Nullable String body, String state,
		LocalDateTime createdAt, LocalDateTime updatedAt, boolean merged, @Nullable LocalDateTime mergedAt,
		@Nullable LocalDateTime closedAt, List<Comment> comments, List<Commit> commits) implements Item {

	public PullRequest {
		comments = List.copyOf(comments);
		commits = List.copyOf(commits);
	}

	@Override
	public ItemCategory category() {
		return ItemCategory.PULL_REQUEST;
	}

	/**
	 * Status for display: "merged" for merged pull requests, otherwise the lower-cased
	 * state.
	 * @return display status
	 */
	public String status() {
		return merged ? "merged" : state.toLowerCase();
	}

}
