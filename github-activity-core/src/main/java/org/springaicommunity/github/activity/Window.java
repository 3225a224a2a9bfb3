package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * A report window covering whole UTC days.
 *
 * <p>
 * The window is half-open: it starts at midnight of {@code start} and ends just before
 * midnight of {@code end}. A window with {@code start == end} is empty. The last day
 * shown to readers is {@link #lastDay()}.
 *
 * @param start first day of the window (inclusive)
 * @param end day after the last day of the window (exclusive)
 */
public record Window(LocalDate start, LocalDate end) {

	public Window {
		if (end.isBefore(start)) {
			throw new IllegalArgumentException("Window end " + end + " is before start " + start);
		}
	}

	/**
	 * Create an empty window anchored at the given day.
	 * @param start the window start
	 * @return window with {@code end == start}
	 */
	public static Window startingAt(LocalDate start) {
		return new Window(start, start);
	}

	public LocalDateTime startTime() {
		return start.atStartOfDay();
	}

	public LocalDateTime endTime() {
		return end.atStartOfDay();
	}

	/**
	 * Whether a timestamp falls inside {@code [start, end)}.
	 * @param timestamp UTC timestamp, null is never contained
	 * @return true if inside the window
	 */
	public boolean contains(@Nullable LocalDateTime timestamp) {
		return timestamp != null && !timestamp.isBefore(startTime()) && timestamp.isBefore(endTime());
	}

	/**
	 * Whether a timestamp lies before the window start.
	 * @param timestamp UTC timestamp
	 * @return true if strictly before the start
	 */
	public boolean isBeforeStart(LocalDateTime timestamp) {
		return timestamp.isBefore(startTime());
	}

	/**
	 * Whether a timestamp lies at or after the window end.
	 * @param timestamp UTC timestamp
	 * @return true if not before the end
	 */
	public boolean isAtOrAfterEnd(LocalDateTime timestamp) {
		return !timestamp.isBefore(endTime());
	}

	/**
	 * Grow the window by a number of days without passing {@code limit}. The end never
	 * moves backwards.
	 * @param days days to add to the end
	 * @param limit latest allowed end
	 * @return the expanded window
	 */
	public Window expand(int days, LocalDate limit) {
		LocalDate candidate = end.plusDays(days);
		if (candidate.isAfter(limit)) {
			candidate = limit;
		}
		return candidate.isAfter(end) ? new Window(start, candidate) : this;
	}

	/**
	 * The last day covered by the window, as shown in reports.
	 * @return {@code end - 1 day}
	 */
	public LocalDate lastDay() {
		return end.minusDays(1);
	}

	public long days() {
		return ChronoUnit.DAYS.between(start, end);
	}

	public boolean isEmpty() {
		return start.equals(end);
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}

}
