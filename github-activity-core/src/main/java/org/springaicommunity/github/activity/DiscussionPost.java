package org.springaicommunity.github.activity;

import java.time.LocalDateTime;

/**
 * A discussion as read back when looking for previously published reports.
 *
 * @param title the discussion title
 * @param body the discussion body, with line endings normalized to {@code \n}
 * @param createdAt when the discussion was created
 */
public record DiscussionPost(String title, String body, LocalDateTime createdAt) {
}
