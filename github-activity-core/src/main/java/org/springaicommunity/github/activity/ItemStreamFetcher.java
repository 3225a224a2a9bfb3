package org.springaicommunity.github.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Fetches all items updated since a horizon date, paginating each category on its own
 * cursor.
 *
 * <p>
 * Categories advance together in rounds: every round requests one page from each
 * category that is still active. A category stops when a page contains an item older
 * than the horizon (by update time, or creation time for releases) or when the API
 * reports no further pages. A failing category is logged and dropped while the others
 * continue; callers that fetch repeatedly pass the same set of failed categories so that a
 * dropped category stays dropped for their whole run.
 *
 * <p>
 * Discussions that are reports published by this tool are left out.
 */
public class ItemStreamFetcher {

	private static final Logger logger = LoggerFactory.getLogger(ItemStreamFetcher.class);

	private static final BooleanSupplier NEVER_CANCELLED = () -> false;

	private final ActivityService activityService;

	private final String reportMarker;

	public ItemStreamFetcher(ActivityService activityService, ActivityProperties properties) {
		this.activityService = activityService;
		this.reportMarker = properties.getPoweredByMarker();
	}

	/**
	 * Fetch every item touched on or after the horizon.
	 * @param repository the repository
	 * @param horizon earliest day of interest
	 * @return items of all categories, most recently updated first
	 */
	public List<Item> fetch(RepositoryRef repository, LocalDate horizon) {
		return fetch(repository, horizon, NEVER_CANCELLED);
	}

	/**
	 * Fetch every item touched on or after the horizon, checking for cancellation before
	 * each round.
	 * @param repository the repository
	 * @param horizon earliest day of interest
	 * @param cancelled checked at each round boundary; when true, pagination stops and the
	 * items of completed rounds are returned
	 * @return items of all categories, most recently updated first; equal timestamps keep
	 * their per-category order
	 */
	public List<Item> fetch(RepositoryRef repository, LocalDate horizon, BooleanSupplier cancelled) {
		return fetch(repository, horizon, cancelled, EnumSet.noneOf(ItemCategory.class));
	}

	/**
	 * Fetch every item touched on or after the horizon, skipping categories that already
	 * failed.
	 * @param repository the repository
	 * @param horizon earliest day of interest
	 * @param cancelled checked at each round boundary
	 * @param failed categories not to query; categories failing during this fetch are
	 * added to it
	 * @return items of the categories that did not fail, most recently updated first
	 */
	public List<Item> fetch(RepositoryRef repository, LocalDate horizon, BooleanSupplier cancelled,
			Set<ItemCategory> failed) {
		LocalDateTime horizonTime = horizon.atStartOfDay();
		long start = System.currentTimeMillis();

		Map<ItemCategory, List<Item>> collected = new EnumMap<>(ItemCategory.class);
		List<CategoryCursor> cursors = new ArrayList<>();
		for (ItemCategory category : ItemCategory.values()) {
			collected.put(category, new ArrayList<>());
			CategoryCursor cursor = CategoryCursor.start(category);
			cursors.add(failed.contains(category) ? cursor.disable() : cursor);
		}

		int round = 0;
		while (cursors.stream().anyMatch(CategoryCursor::active)) {
			if (cancelled.getAsBoolean()) {
				logger.info("Fetch cancelled after {} round(s)", round);
				break;
			}
			round++;
			List<CategoryCursor> next = new ArrayList<>(cursors.size());
			for (CategoryCursor cursor : cursors) {
				next.add(cursor.active()
						? fetchPage(repository, cursor, horizonTime, collected.get(cursor.category()), failed, round)
						: cursor);
			}
			cursors = next;
		}

		List<Item> items = new ArrayList<>();
		for (ItemCategory category : ItemCategory.values()) {
			items.addAll(collected.get(category));
		}
		items.sort(Comparator.comparing(Item::updatedAt).reversed());

		logger.debug("Fetched {} items since {} in {} round(s), {}ms", items.size(), horizon, round,
				System.currentTimeMillis() - start);
		return items;
	}

	private CategoryCursor fetchPage(RepositoryRef repository, CategoryCursor cursor, LocalDateTime horizon,
			List<Item> sink, Set<ItemCategory> failed, int round) {
		ItemCategory category = cursor.category();
		PageResult<Item> page;
		try {
			page = activityService.fetchItems(repository, category, cursor.after());
		}
		catch (QueryException e) {
			logger.warn("Fetching {} failed on page {}, skipping the rest of this category: {}",
					category.label().toLowerCase(), cursor.pages() + 1, e.getMessage());
			failed.add(category);
			return cursor.disable();
		}

		boolean reachedHorizon = false;
		int kept = 0;
		for (Item item : page.items()) {
			if (horizonTimestamp(item).isBefore(horizon)) {
				reachedHorizon = true;
				break;
			}
			if (isPublishedReport(item)) {
				logger.debug("Skipping published report '{}'", item.title());
				continue;
			}
			sink.add(item);
			kept++;
		}

		logger.info("Round {}: {} {}", round, kept, category.label().toLowerCase());
		return cursor.advance(page, kept, reachedHorizon);
	}

	private static LocalDateTime horizonTimestamp(Item item) {
		return switch (item.category()) {
			case RELEASE -> item.createdAt();
			case PULL_REQUEST, ISSUE, DISCUSSION -> item.updatedAt();
		};
	}

	private boolean isPublishedReport(Item item) {
		return item.category() == ItemCategory.DISCUSSION && ReportFooter.isPublishedReport(item.body(), reportMarker);
	}

}
