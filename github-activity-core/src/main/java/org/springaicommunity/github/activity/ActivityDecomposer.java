package org.springaicommunity.github.activity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flattens an item's nested events into a chronological list of activities inside a
 * window.
 *
 * <p>
 * Emits one activity per comment and, for pull requests, per commit in the window,
 * followed by either a merge activity (pull request merged in the window) or a close
 * activity (closed in the window), never both. An included item may have no activities
 * at all, for example one that was only created in the window.
 */
public class ActivityDecomposer {

	private static final Comparator<Activity> BY_DATE = Comparator.comparing(Activity::date);

	/**
	 * Decompose an item against a window.
	 * @param item the item
	 * @param window the report window
	 * @return activities inside the window, oldest first
	 */
	public List<Activity> decompose(Item item, Window window) {
		List<Activity> activities = new ArrayList<>();

		for (Comment comment : item.comments()) {
			if (window.contains(comment.createdAt())) {
				activities.add(Activity.comment(comment));
			}
		}

		switch (item.category()) {
			case PULL_REQUEST -> {
				PullRequest pullRequest = (PullRequest) item;
				for (Commit commit : pullRequest.commits()) {
					if (window.contains(commit.committedDate())) {
						activities.add(Activity.commit(commit));
					}
				}
				if (window.contains(pullRequest.mergedAt())) {
					activities.add(Activity.merge(pullRequest.mergedAt()));
				}
				else if (window.contains(pullRequest.closedAt())) {
					activities.add(Activity.close(pullRequest.closedAt()));
				}
			}
			case ISSUE, DISCUSSION -> {
				if (window.contains(item.closedAt())) {
					activities.add(Activity.close(item.closedAt()));
				}
			}
			case RELEASE -> {
			}
		}

		activities.sort(BY_DATE);
		return List.copyOf(activities);
	}

	/**
	 * Count the activities that make a window worth reporting.
	 * @param activities activities of one or more items
	 * @return number of comments and commits
	 */
	public static long countContributions(List<Activity> activities) {
		return activities.stream().filter(activity -> activity.type().isContribution()).count();
	}

}
