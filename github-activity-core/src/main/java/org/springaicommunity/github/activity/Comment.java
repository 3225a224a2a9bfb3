package org.springaicommunity.github.activity;

import java.time.LocalDateTime;

/**
 * A comment on a pull request, issue or discussion.
 *
 * @param author the user who wrote the comment
 * @param body the comment text content
 * @param createdAt when the comment was created
 */
public record Comment(Author author, String body, LocalDateTime createdAt) {
}
