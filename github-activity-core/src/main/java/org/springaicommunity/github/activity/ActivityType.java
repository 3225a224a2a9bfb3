package org.springaicommunity.github.activity;

/**
 * Kind of dated sub-event belonging to an item.
 */
public enum ActivityType {

	COMMENT, COMMIT, MERGE, CLOSE;

	/**
	 * Whether this activity counts towards the content threshold of a window.
	 * @return true for comments and commits
	 */
	public boolean isContribution() {
		return this == COMMENT || this == COMMIT;
	}

}
