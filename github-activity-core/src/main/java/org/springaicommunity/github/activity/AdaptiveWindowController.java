package org.springaicommunity.github.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Grows a report window from a fixed start day until it holds enough activity or reaches
 * today.
 *
 * <p>
 * The window starts empty at {@code start} and its end advances by
 * {@link ActivityProperties#getWindowStepDays()} per iteration, capped at today. Every
 * iteration fetches, classifies and decomposes the whole window again, since merge and
 * close state of already seen items can change between iterations. A category that fails
 * once is not queried again in the same run. The window is
 * satisfied once it holds at least {@link ActivityProperties#getMinItems()} items and
 * {@link ActivityProperties#getMinActivities()} comment or commit activities.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * var controller = new AdaptiveWindowController(fetcher, properties, Clock.systemUTC());
 * WindowResult result = controller.run(RepositoryRef.parse("owner/repo"), LocalDate.of(2024, 1, 1));
 * if (result.isSatisfied()) {
 *     // render and publish
 * }
 * }</pre>
 */
public class AdaptiveWindowController {

	private static final Logger logger = LoggerFactory.getLogger(AdaptiveWindowController.class);

	private final ItemStreamFetcher fetcher;

	private final ItemClassifier classifier;

	private final ActivityDecomposer decomposer;

	private final Clock clock;

	private final int stepDays;

	private final int minItems;

	private final int minActivities;

	public AdaptiveWindowController(ItemStreamFetcher fetcher, ActivityProperties properties, Clock clock) {
		this(fetcher, new ItemClassifier(), new ActivityDecomposer(), properties, clock);
	}

	public AdaptiveWindowController(ItemStreamFetcher fetcher, ItemClassifier classifier, ActivityDecomposer decomposer,
			ActivityProperties properties, Clock clock) {
		this.fetcher = fetcher;
		this.classifier = classifier;
		this.decomposer = decomposer;
		this.clock = clock;
		this.stepDays = properties.getWindowStepDays();
		this.minItems = properties.getMinItems();
		this.minActivities = properties.getMinActivities();
	}

	public WindowResult run(RepositoryRef repository, LocalDate start) {
		return run(repository, start, () -> false);
	}

	/**
	 * Expand the window until it is satisfied or exhausted.
	 * @param repository the repository
	 * @param start first day of the window; never changes during the run
	 * @param cancelled checked by the fetcher at pagination round boundaries
	 * @return the terminal state with the last evaluated window and its items
	 */
	public WindowResult run(RepositoryRef repository, LocalDate start, BooleanSupplier cancelled) {
		LocalDate today = LocalDate.now(clock);
		Window window = Window.startingAt(start);
		List<Window> attempted = new ArrayList<>();
		List<ReportItem> items = List.of();

		if (!start.isBefore(today)) {
			logger.info("Start {} is not before today ({}), nothing to report", start, today);
			return new WindowResult(WindowState.EXHAUSTED, window, items, attempted);
		}

		Set<ItemCategory> failed = EnumSet.noneOf(ItemCategory.class);
		WindowState state = WindowState.EXPANDING;
		while (!state.isTerminal()) {
			window = window.expand(stepDays, today);
			attempted.add(window);

			items = evaluate(repository, window, cancelled, failed);
			long contributions = items.stream().mapToLong(ReportItem::contributions).sum();
			logger.info("Window {}: {} item(s), {} contribution(s)", window, items.size(), contributions);

			if (items.size() >= minItems && contributions >= minActivities) {
				state = WindowState.SATISFIED;
			}
			else if (!window.end().isBefore(today)) {
				state = WindowState.EXHAUSTED;
			}
		}

		if (state == WindowState.EXHAUSTED) {
			logger.info("Window {} reached today without enough activity (need {} item(s), {} contribution(s))",
					window, minItems, minActivities);
		}
		return new WindowResult(state, window, items, attempted);
	}

	/**
	 * Fetch, classify and decompose everything in one window.
	 * @param repository the repository
	 * @param window the window
	 * @param cancelled cancellation check
	 * @param failed categories that failed earlier in the run
	 * @return included items with their activities
	 */
	List<ReportItem> evaluate(RepositoryRef repository, Window window, BooleanSupplier cancelled,
			Set<ItemCategory> failed) {
		List<ReportItem> included = new ArrayList<>();
		for (Item item : fetcher.fetch(repository, window.start(), cancelled, failed)) {
			Optional<InclusionReason> reason = classifier.classify(item, window);
			if (reason.isPresent()) {
				included.add(new ReportItem(item, reason.get(), decomposer.decompose(item, window)));
			}
			else if (logger.isDebugEnabled()) {
				logger.debug("Excluded {} '{}'", item.category(), item.title());
			}
		}
		return included;
	}

}
