package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

/**
 * A GitHub user who wrote a comment.
 *
 * @param login the GitHub username
 * @param name the user's display name (may be null if not set in their profile)
 */
public record Author(String login, @Nullable String name) {

	/**
	 * Placeholder for comments whose author account no longer exists.
	 */
	public static final Author GHOST = new Author("ghost", null);

}
