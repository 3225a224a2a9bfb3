package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides whether an item belongs to a report window.
 *
 * <p>
 * An item can be alive in a window through its creation, a state transition or any
 * nested event, even when its own {@code updatedAt} predates the window. The rules are
 * evaluated in order and the first one that decides wins:
 * <ol>
 * <li>a release is included only if it was created in the window;</li>
 * <li>an item created at or after the window end is excluded;</li>
 * <li>an item updated in the window is included;</li>
 * <li>an item created in the window is included;</li>
 * <li>an item closed before the window is excluded, closed in the window included;</li>
 * <li>a pull request merged before the window is excluded, merged in the window
 * included;</li>
 * <li>an item with a comment in the window is included;</li>
 * <li>a pull request with a commit in the window is included;</li>
 * <li>anything else is excluded.</li>
 * </ol>
 */
public class ItemClassifier {

	/**
	 * Whether the item belongs to the window.
	 * @param item the item
	 * @param window the report window
	 * @return true if any rule includes the item
	 */
	public boolean shouldInclude(Item item, Window window) {
		return classify(item, window).isPresent();
	}

	/**
	 * Apply the inclusion rules.
	 * @param item the item
	 * @param window the report window
	 * @return the rule that included the item, or empty if it is excluded
	 */
	public Optional<InclusionReason> classify(Item item, Window window) {
		if (item.category() == ItemCategory.RELEASE) {
			return window.contains(item.createdAt()) ? Optional.of(InclusionReason.RELEASE_CREATED) : Optional.empty();
		}

		if (window.isAtOrAfterEnd(item.createdAt())) {
			return Optional.empty();
		}
		if (window.contains(item.updatedAt())) {
			return Optional.of(InclusionReason.UPDATED_IN_WINDOW);
		}
		if (window.contains(item.createdAt())) {
			return Optional.of(InclusionReason.CREATED_IN_WINDOW);
		}

		Optional<Boolean> closed = transition(item.closedAt(), window);
		if (closed.isPresent()) {
			return closed.get() ? Optional.of(InclusionReason.CLOSED_IN_WINDOW) : Optional.empty();
		}

		if (item instanceof PullRequest pullRequest) {
			Optional<Boolean> merged = transition(pullRequest.mergedAt(), window);
			if (merged.isPresent()) {
				return merged.get() ? Optional.of(InclusionReason.MERGED_IN_WINDOW) : Optional.empty();
			}
		}

		for (Comment comment : item.comments()) {
			if (window.contains(comment.createdAt())) {
				return Optional.of(InclusionReason.COMMENT_IN_WINDOW);
			}
		}

		if (item instanceof PullRequest pullRequest) {
			for (Commit commit : pullRequest.commits()) {
				if (window.contains(commit.committedDate())) {
					return Optional.of(InclusionReason.COMMIT_IN_WINDOW);
				}
			}
		}

		return Optional.empty();
	}

	/**
	 * Decide on a state transition timestamp.
	 * @return empty if undecided, true to include, false to exclude
	 */
	private static Optional<Boolean> transition(@Nullable LocalDateTime timestamp, Window window) {
		if (timestamp == null) {
			return Optional.empty();
		}
		if (window.isBeforeStart(timestamp)) {
			return Optional.of(false);
		}
		if (window.contains(timestamp)) {
			return Optional.of(true);
		}
		return Optional.empty();
	}

}
