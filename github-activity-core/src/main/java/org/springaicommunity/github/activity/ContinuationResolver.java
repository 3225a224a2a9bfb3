package org.springaicommunity.github.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Recovers where the previous run stopped by reading the reports it published.
 *
 * <p>
 * Reports are discussions in a dedicated category whose body ends with a
 * {@link ReportFooter}. Nothing is cached between runs, so edited or deleted reports are
 * reflected immediately.
 */
public class ContinuationResolver {

	private static final Logger logger = LoggerFactory.getLogger(ContinuationResolver.class);

	private final DiscussionService discussionService;

	private final int summaryCount;

	private final String marker;

	public ContinuationResolver(DiscussionService discussionService, ActivityProperties properties) {
		this.discussionService = discussionService;
		this.summaryCount = properties.getSummaryCount();
		this.marker = properties.getPoweredByMarker();
	}

	/**
	 * Find the newest previously published reports of a category.
	 * @param repository the repository
	 * @param categoryName the discussion category reports are published to
	 * @return at most {@code summaryCount} records, newest {@code endDate} first; empty if
	 * the category does not exist
	 * @throws QueryException if the discussions cannot be read
	 */
	public List<ContinuationRecord> resolve(RepositoryRef repository, String categoryName) {
		Optional<String> categoryId = discussionService.findCategoryId(repository, categoryName);
		if (categoryId.isEmpty()) {
			logger.warn("Discussion category '{}' not found in {}; assuming no previous reports", categoryName,
					repository);
			return List.of();
		}

		List<DiscussionPost> posts = discussionService.getRecentDiscussions(repository, categoryId.get(),
				summaryCount);
		List<ContinuationRecord> records = parse(posts);
		logger.info("Found {} previous report(s) in '{}' out of {} discussion(s)", records.size(), categoryName,
				posts.size());
		return records;
	}

	/**
	 * Turn discussion posts into continuation records, skipping posts without a valid
	 * footer.
	 * @param posts candidate posts
	 * @return records sorted by {@code endDate} descending, at most {@code summaryCount};
	 * of two reports with the same {@code endDate} the more recently posted comes first
	 */
	public List<ContinuationRecord> parse(List<DiscussionPost> posts) {
		List<DiscussionPost> newestFirst = new ArrayList<>(posts);
		newestFirst.sort(Comparator.comparing(DiscussionPost::createdAt).reversed());

		List<ContinuationRecord> records = new ArrayList<>();
		for (DiscussionPost post : newestFirst) {
			Optional<ReportFooter> footer = ReportFooter.parse(post.body(), marker);
			if (footer.isEmpty()) {
				logger.warn("Discussion '{}' has no readable report footer, skipping", post.title());
				continue;
			}
			records.add(new ContinuationRecord(footer.get().endDate(), post.title(), ReportFooter.strip(post.body())));
		}
		records.sort(Comparator.comparing(ContinuationRecord::endDate).reversed());
		return records.size() > summaryCount ? List.copyOf(records.subList(0, summaryCount)) : List.copyOf(records);
	}

	/**
	 * The first day of the next report.
	 * @param records previous reports, newest first
	 * @param repositoryCreated creation day of the repository
	 * @return the day after the newest report, or the creation day if there is none
	 */
	public LocalDate nextStartDate(List<ContinuationRecord> records, LocalDate repositoryCreated) {
		if (records.isEmpty()) {
			return repositoryCreated;
		}
		return records.get(0).nextStartDate();
	}

}
