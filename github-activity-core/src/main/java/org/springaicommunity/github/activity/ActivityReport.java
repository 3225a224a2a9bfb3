package org.springaicommunity.github.activity;

import java.util.List;

/**
 * Result of one aggregation run, ready for rendering and publishing.
 *
 * @param repository the resolved repository
 * @param window the report window
 * @param state how the window ended
 * @param items included items with their activities, most recently updated first
 * @param previousSummaries reports recovered from earlier runs, newest first
 */
public record ActivityReport(RepositoryInfo repository, Window window, WindowState state, List<ReportItem> items,
		List<ContinuationRecord> previousSummaries) {

	public ActivityReport {
		items = List.copyOf(items);
		previousSummaries = List.copyOf(previousSummaries);
	}

	/**
	 * Whether the run produced a report. A run that exhausted its window ends normally
	 * but has nothing worth publishing.
	 * @return true if the window was satisfied
	 */
	public boolean hasContent() {
		return state == WindowState.SATISFIED;
	}

	public List<ReportItem> itemsOf(ItemCategory category) {
		return items.stream().filter(reportItem -> reportItem.item().category() == category).toList();
	}

}
