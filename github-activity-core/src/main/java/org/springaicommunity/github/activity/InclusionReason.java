package org.springaicommunity.github.activity;

/**
 * Why an item was included in a report window. Declared in the order the rules are
 * evaluated by {@link ItemClassifier}.
 */
public enum InclusionReason {

	/**
	 * A release created inside the window.
	 */
	RELEASE_CREATED,

	/**
	 * The item's update timestamp falls inside the window.
	 */
	UPDATED_IN_WINDOW,

	/**
	 * The item was created inside the window.
	 */
	CREATED_IN_WINDOW,

	/**
	 * The item was closed inside the window.
	 */
	CLOSED_IN_WINDOW,

	/**
	 * The pull request was merged inside the window.
	 */
	MERGED_IN_WINDOW,

	/**
	 * A comment was written inside the window.
	 */
	COMMENT_IN_WINDOW,

	/**
	 * A pull request commit was made inside the window.
	 */
	COMMIT_IN_WINDOW

}
