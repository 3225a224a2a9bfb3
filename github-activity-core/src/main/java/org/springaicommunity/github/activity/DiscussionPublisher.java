package org.springaicommunity.github.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes a report as a GitHub discussion, creating the target category on first use.
 */
public class DiscussionPublisher {

	private static final Logger logger = LoggerFactory.getLogger(DiscussionPublisher.class);

	private final DiscussionService discussionService;

	public DiscussionPublisher(DiscussionService discussionService) {
		this.discussionService = discussionService;
	}

	/**
	 * Create a discussion in the named category.
	 * @param repository the repository to publish to
	 * @param categoryName the discussion category, created if missing
	 * @param title discussion title
	 * @param body discussion body including the report footer
	 * @return the URL of the new discussion
	 * @throws QueryException if the category or the discussion cannot be created
	 */
	public String publish(RepositoryInfo repository, String categoryName, String title, String body) {
		RepositoryRef ref = RepositoryRef.parse(repository.nameWithOwner());
		try {
			String categoryId = discussionService.findCategoryId(ref, categoryName).orElseGet(() -> {
				logger.info("Creating discussion category '{}' in {}", categoryName, ref);
				return discussionService.createCategory(repository.id(), categoryName);
			});
			String url = discussionService.createDiscussion(repository.id(), categoryId, title, body);
			logger.info("Discussion created: {}", url);
			logger.debug("Title: \"{}\"", title);
			return url;
		}
		catch (QueryException e) {
			logger.error("Error creating discussion in {}: {}", ref, e.getMessage());
			throw e;
		}
	}

}
