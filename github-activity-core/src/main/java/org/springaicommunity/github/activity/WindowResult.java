package org.springaicommunity.github.activity;

import java.util.List;

/**
 * Outcome of an adaptive window run.
 *
 * @param state {@link WindowState#SATISFIED} or {@link WindowState#EXHAUSTED}
 * @param window the last window evaluated
 * @param items items included in {@code window}, most recently updated first
 * @param attemptedWindows every window evaluated, in order
 */
public record WindowResult(WindowState state, Window window, List<ReportItem> items, List<Window> attemptedWindows) {

	public WindowResult {
		items = List.copyOf(items);
		attemptedWindows = List.copyOf(attemptedWindows);
	}

	public boolean isSatisfied() {
		return state == WindowState.SATISFIED;
	}

	public long contributions() {
		return items.stream().mapToLong(ReportItem::contributions).sum();
	}

}
