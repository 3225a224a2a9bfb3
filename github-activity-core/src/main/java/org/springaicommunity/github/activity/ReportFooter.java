package org.springaicommunity.github.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Machine-readable footer embedded in every published report.
 *
 * <p>
 * The footer is a fenced {@code json} block inside a collapsed {@code <details>} element
 * at the end of the discussion body:
 *
 * <pre>
 * ---
 *
 * &lt;details&gt;&lt;summary&gt;&lt;/summary&gt;
 *
 * ```json
 * {
 *   "start_date" : "2024-01-01",
 *   "end_date" : "2024-01-07",
 *   "powered_by" : "https://github.com/spring-ai-community/github-activity-summary",
 *   "llm" : "none"
 * }
 * ```
 * &lt;/details&gt;
 * </pre>
 *
 * {@code end_date} is the last day covered by the report, so the next report starts the
 * day after.
 *
 * @param startDate first day covered by the report
 * @param endDate last day covered by the report
 * @param poweredBy identifies the tool that published the report
 * @param llm the model that wrote the summary, or "none"
 */
@JsonPropertyOrder({ "start_date", "end_date", "powered_by", "llm" })
public record ReportFooter(@JsonProperty("start_date") @Nullable LocalDate startDate,
		@JsonProperty("end_date") LocalDate endDate, @JsonProperty("powered_by") String poweredBy,
		@JsonProperty("llm") String llm) {

	private static final Logger logger = LoggerFactory.getLogger(ReportFooter.class);

	private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

	private static final Pattern JSON_BLOCK = Pattern.compile("```json\\n(.*?)\\n```", Pattern.DOTALL);

	private static final Pattern FOOTER_SECTION = Pattern.compile("\\n*---\\n\\n<details>.*$", Pattern.DOTALL);

	/**
	 * Footer for a report covering the given window.
	 * @param window the report window
	 * @param poweredBy value of the {@code powered_by} field
	 * @param llm model name, or "none"
	 * @return the footer, with {@code end_date} set to the window's last day
	 */
	public static ReportFooter forWindow(Window window, String poweredBy, String llm) {
		return new ReportFooter(window.start(), window.lastDay(), poweredBy, llm);
	}

	/**
	 * Extract the footer from a report body.
	 * @param body discussion body, any line endings
	 * @param marker text that {@code powered_by} must contain
	 * @return the footer, or empty if the body has no well-formed footer from this tool
	 */
	public static Optional<ReportFooter> parse(@Nullable String body, String marker) {
		if (body == null) {
			return Optional.empty();
		}
		Matcher matcher = JSON_BLOCK.matcher(body.replace("\r\n", "\n"));
		if (!matcher.find()) {
			return Optional.empty();
		}
		try {
			JsonNode metadata = MAPPER.readTree(matcher.group(1));
			String poweredBy = metadata.path("powered_by").asText("");
			String endDate = metadata.path("end_date").asText("");
			if (!poweredBy.contains(marker) || endDate.isEmpty()) {
				return Optional.empty();
			}
			String startDate = metadata.path("start_date").asText("");
			return Optional.of(new ReportFooter(startDate.isEmpty() ? null : LocalDate.parse(startDate),
					LocalDate.parse(endDate), poweredBy, metadata.path("llm").asText("")));
		}
		catch (JsonProcessingException | DateTimeParseException e) {
			logger.debug("Ignoring malformed report footer: {}", e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Whether a body carries a footer published by this tool.
	 * @param body discussion body
	 * @param marker text that {@code powered_by} must contain
	 * @return true if {@link #parse} finds a footer
	 */
	public static boolean isPublishedReport(@Nullable String body, String marker) {
		return parse(body, marker).isPresent();
	}

	/**
	 * Remove the footer section from a report body.
	 * @param body discussion body
	 * @return body without the trailing footer, line endings normalized
	 */
	public static String strip(String body) {
		return FOOTER_SECTION.matcher(body.replace("\r\n", "\n")).replaceFirst("").strip();
	}

	/**
	 * Render the footer section to append to a report body.
	 * @return footer Markdown, starting with a horizontal rule
	 */
	public String render() {
		String json;
		try {
			json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize report footer", e);
		}
		return "---\n\n<details><summary></summary>\n\n```json\n" + json + "\n```\n</details>\n";
	}

	/**
	 * Append this footer to a report body.
	 * @param content report content
	 * @return content followed by the footer section
	 */
	public String appendTo(String content) {
		return content.strip() + "\n\n" + render();
	}

}
