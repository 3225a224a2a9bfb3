package org.springaicommunity.github.activity;

import java.util.List;

/**
 * An item included in a report window together with its window-scoped activities.
 *
 * @param item the item
 * @param reason the rule that included it
 * @param activities activities inside the window, oldest first; may be empty
 */
public record ReportItem(Item item, InclusionReason reason, List<Activity> activities) {

	public ReportItem {
		activities = List.copyOf(activities);
	}

	public long contributions() {
		return ActivityDecomposer.countContributions(activities);
	}

}
