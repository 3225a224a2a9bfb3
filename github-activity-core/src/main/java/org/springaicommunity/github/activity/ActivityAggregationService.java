package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Entry point of a run: resolves the repository and the report start day, then lets the
 * {@link AdaptiveWindowController} find a window with enough activity.
 *
 * <p>
 * The start day is, in order of preference, the explicit override, the day after the
 * newest report published to the category, or the repository creation day.
 */
public class ActivityAggregationService {

	private static final Logger logger = LoggerFactory.getLogger(ActivityAggregationService.class);

	private final ActivityService activityService;

	private final ContinuationResolver continuationResolver;

	private final AdaptiveWindowController windowController;

	public ActivityAggregationService(ActivityService activityService, ContinuationResolver continuationResolver,
			AdaptiveWindowController windowController) {
		this.activityService = activityService;
		this.continuationResolver = continuationResolver;
		this.windowController = windowController;
	}

	public ActivityReport aggregate(RepositoryRef repository, @Nullable String category,
			@Nullable LocalDate startOverride) {
		return aggregate(repository, category, startOverride, () -> false);
	}

	/**
	 * Aggregate the activity of a repository since its last report.
	 * @param repository the repository
	 * @param category discussion category holding previous reports, or null to skip
	 * continuation
	 * @param startOverride explicit first day, or null to derive it
	 * @param cancelled checked at pagination round boundaries
	 * @return the report; check {@link ActivityReport#hasContent()} before publishing
	 * @throws RepositoryResolutionException if the repository cannot be resolved
	 * @throws QueryException if previous reports cannot be read
	 */
	public ActivityReport aggregate(RepositoryRef repository, @Nullable String category,
			@Nullable LocalDate startOverride, BooleanSupplier cancelled) {
		long start = System.currentTimeMillis();
		RepositoryInfo info = resolveRepository(repository);

		List<ContinuationRecord> previous = category != null ? continuationResolver.resolve(repository, category)
				: List.of();

		LocalDate startDate;
		if (startOverride != null) {
			startDate = startOverride;
			logger.info("Using start date {} from override", startDate);
		}
		else {
			startDate = continuationResolver.nextStartDate(previous, info.createdAt().toLocalDate());
			logger.info("Using start date {} ({})", startDate,
					previous.isEmpty() ? "repository creation" : "after previous report");
		}

		WindowResult result = windowController.run(repository, startDate, cancelled);
		logger.info("Aggregated {} in {}ms: {} window {} with {} item(s) after {} expansion(s)", repository,
				System.currentTimeMillis() - start, result.state(), result.window(), result.items().size(),
				result.attemptedWindows().size());

		return new ActivityReport(info, result.window(), result.state(), result.items(), previous);
	}

	private RepositoryInfo resolveRepository(RepositoryRef repository) {
		try {
			RepositoryInfo info = activityService.getRepository(repository);
			logger.debug("Resolved {} (created {})", info.nameWithOwner(), info.createdAt());
			return info;
		}
		catch (QueryException e) {
			logger.error("Cannot resolve repository {}: {}", repository, e.getMessage());
			throw new RepositoryResolutionException("Cannot resolve repository " + repository, e);
		}
	}

}
