package org.springaicommunity.github.activity;

import java.time.LocalDate;

/**
 * Metadata recovered from a previously published report.
 *
 * @param endDate last day covered by the report
 * @param title the report title
 * @param summaryText the report body without its footer
 */
public record ContinuationRecord(LocalDate endDate, String title, String summaryText) {

	/**
	 * The day the next report should start.
	 * @return {@code endDate + 1 day}
	 */
	public LocalDate nextStartDate() {
		return endDate.plusDays(1);
	}

	/**
	 * Title and summary joined for use as context when writing the next summary.
	 * @return title, blank line, summary text
	 */
	public String contextText() {
		return title + "\n\n" + summaryText;
	}

}
