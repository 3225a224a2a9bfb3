package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses GitHub ISO-8601 timestamps into UTC {@link LocalDateTime} values.
 */
final class GitHubTimestamps {

	private GitHubTimestamps() {
	}

	/**
	 * Parse a timestamp that may be absent.
	 * @param node JSON value, possibly missing or null
	 * @return the UTC timestamp, or null when absent
	 * @throws DateTimeParseException if a value is present but malformed
	 */
	static @Nullable LocalDateTime parseOptional(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || node.asText().isEmpty()) {
			return null;
		}
		return parse(node.asText());
	}

	/**
	 * Parse a timestamp that must be present.
	 * @param node JSON value
	 * @param field field name for the error message
	 * @return the UTC timestamp
	 * @throws DateTimeParseException if the value is missing or malformed
	 */
	static LocalDateTime parseRequired(JsonNode node, String field) {
		LocalDateTime value = parseOptional(node);
		if (value == null) {
			throw new DateTimeParseException("Missing timestamp '" + field + "'", "", 0);
		}
		return value;
	}

	static LocalDateTime parse(String text) {
		try {
			return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
		}
		catch (DateTimeParseException e) {
			return LocalDateTime.parse(text);
		}
	}

}
