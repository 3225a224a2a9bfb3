package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders an {@link ActivityReport} as Markdown, one section per item category.
 *
 * <p>
 * Comment and commit messages are collapsed to a single line and cut to
 * {@link ActivityProperties#getMessageExcerptLength()} characters.
 */
public class MarkdownReportRenderer {

	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

	private static final String ELLIPSIS = "...";

	private final int excerptLength;

	public MarkdownReportRenderer(ActivityProperties properties) {
		this.excerptLength = properties.getMessageExcerptLength();
	}

	/**
	 * Title for a published report.
	 * @param report the report
	 * @return e.g. {@code owner/repo activity 2024-01-01 to 2024-01-07}
	 */
	public String title(ActivityReport report) {
		Window window = report.window();
		return report.repository().nameWithOwner() + " activity " + window.start() + " to " + window.lastDay();
	}

	public String render(ActivityReport report) {
		StringBuilder markdown = new StringBuilder();
		markdown.append("# ").append(title(report)).append("\n");

		if (report.items().isEmpty()) {
			markdown.append("\nNo activity in this period.\n");
		}
		for (ItemCategory category : ItemCategory.values()) {
			List<ReportItem> items = report.itemsOf(category);
			if (items.isEmpty()) {
				continue;
			}
			markdown.append("\n## ").append(category.label()).append("\n");
			for (ReportItem reportItem : items) {
				renderItem(markdown, reportItem);
			}
		}

		if (!report.previousSummaries().isEmpty()) {
			markdown.append("\n## Previous reports\n\n");
			for (ContinuationRecord previous : report.previousSummaries()) {
				markdown.append("- ").append(previous.title()).append(" (until ").append(previous.endDate()).append(")\n");
			}
		}
		return markdown.toString();
	}

	private void renderItem(StringBuilder markdown, ReportItem reportItem) {
		Item item = reportItem.item();
		markdown.append("\n### ").append(heading(item)).append("\n\n");
		markdown.append(item.url()).append("\n");

		if (item instanceof Release release) {
			String description = excerpt(release.description());
			if (!description.isEmpty()) {
				markdown.append("\n").append(description).append("\n");
			}
			return;
		}

		if (reportItem.activities().isEmpty()) {
			markdown.append("\n_").append(describe(reportItem.reason())).append("._\n");
			return;
		}
		markdown.append("\n");
		for (Activity activity : reportItem.activities()) {
			markdown.append("- ").append(TIMESTAMP.format(activity.date())).append(" ").append(describe(activity));
			String message = excerpt(activity.message());
			if (!message.isEmpty()) {
				markdown.append(": ").append(message);
			}
			markdown.append("\n");
		}
	}

	private static String heading(Item item) {
		return switch (item.category()) {
			case PULL_REQUEST -> {
				PullRequest pullRequest = (PullRequest) item;
				yield "#" + pullRequest.number() + ": " + pullRequest.title() + " (" + pullRequest.status() + ")";
			}
			case ISSUE -> {
				Issue issue = (Issue) item;
				yield "#" + issue.number() + ": " + issue.title() + " (" + issue.state().toLowerCase() + ")";
			}
			case DISCUSSION -> {
				Discussion discussion = (Discussion) item;
				yield "#" + discussion.number() + ": " + discussion.title() + " (" + discussion.categoryName() + ")";
			}
			case RELEASE -> {
				Release release = (Release) item;
				yield release.title().equals(release.tagName()) ? release.tagName()
						: release.title() + " (" + release.tagName() + ")";
			}
		};
	}

	private static String describe(Activity activity) {
		return switch (activity.type()) {
			case COMMENT -> "comment by @" + activity.author();
			case COMMIT -> "commit by " + activity.author();
			case MERGE -> "merged";
			case CLOSE -> "closed";
		};
	}

	private static String describe(InclusionReason reason) {
		return switch (reason) {
			case CREATED_IN_WINDOW -> "Opened in this period";
			case UPDATED_IN_WINDOW -> "Updated in this period";
			case CLOSED_IN_WINDOW -> "Closed in this period";
			case MERGED_IN_WINDOW -> "Merged in this period";
			case RELEASE_CREATED -> "Released in this period";
			case COMMENT_IN_WINDOW, COMMIT_IN_WINDOW -> "Active in this period";
		};
	}

	/**
	 * Collapse a message to one line and cut it to the excerpt length.
	 * @param text message, may be null
	 * @return single-line excerpt, empty for null or blank input
	 */
	String excerpt(@Nullable String text) {
		if (text == null) {
			return "";
		}
		String line = text.strip().replaceAll("\\s+", " ");
		if (line.length() <= excerptLength) {
			return line;
		}
		return line.substring(0, excerptLength).stripTrailing() + ELLIPSIS;
	}

}
