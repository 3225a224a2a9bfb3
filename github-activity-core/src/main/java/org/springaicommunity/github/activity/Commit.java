package org.springaicommunity.github.activity;

import java.time.LocalDateTime;

/**
 * A commit belonging to a pull request.
 *
 * @param message the commit message
 * @param committedDate when the commit was committed
 * @param authorName the commit author's name as recorded in git
 */
public record Commit(String message, LocalDateTime committedDate, String authorName) {
}
