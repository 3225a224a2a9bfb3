package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A dated sub-event of an item inside one report window. Activities exist only for the
 * duration of an aggregation run.
 *
 * @param type the kind of event
 * @param date when the event happened (UTC)
 * @param author comment login or commit author name, null for merge and close
 * @param message trimmed comment body or commit message, null for merge and close
 */
public record Activity(ActivityType type, LocalDateTime date, @Nullable String author, @Nullable String message) {

	public static Activity comment(Comment comment) {
		return new Activity(ActivityType.COMMENT, comment.createdAt(), comment.author().login(),
				comment.body().strip());
	}

	public static Activity commit(Commit commit) {
		return new Activity(ActivityType.COMMIT, commit.committedDate(), commit.authorName(),
				commit.message().strip());
	}

	public static Activity merge(LocalDateTime mergedAt) {
		return new Activity(ActivityType.MERGE, mergedAt, null, null);
	}

	public static Activity close(LocalDateTime closedAt) {
		return new Activity(ActivityType.CLOSE, closedAt, null, null);
	}

}
