package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A GitHub release. Releases have no number, comments or update history; their creation
 * time doubles as their update time.
 *
 * @param name the release title (may be null, falls back to the tag name)
 * @param tagName the Git tag name (e.g., "v1.0.0")
 * @param url the web URL of the release page
 * @param description the release notes in Markdown (may be null)
 * @param createdAt when the release was created
 */
public record Release(@Nullable String name, String tagName, String url, @Nullable String description,
		LocalDateTime createdAt) implements Item {

	@Override
	public ItemCategory category() {
		return ItemCategory.RELEASE;
	}

	@Override
	public String title() {
		return name != null && !name.isBlank() ? name : tagName;
	}

	@Override
	public @Nullable String body() {
		return description;
	}

	@Override
	public LocalDateTime updatedAt() {
		return createdAt;
	}

}
