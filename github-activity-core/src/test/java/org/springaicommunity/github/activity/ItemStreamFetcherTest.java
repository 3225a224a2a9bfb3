package org.springaicommunity.github.activity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.activity.TestItems.*;

/**
 * Tests for {@link ItemStreamFetcher} with a mocked {@link ActivityService}.
 */
@DisplayName("ItemStreamFetcher Tests")
@ExtendWith(MockitoExtension.class)
class ItemStreamFetcherTest {

	private static final RepositoryRef REPO = new RepositoryRef("owner", "repo");

	private static final LocalDate HORIZON = LocalDate.of(2024, 1, 1);

	@Mock
	private ActivityService activityService;

	private ItemStreamFetcher fetcher;

	@BeforeEach
	void setUp() {
		fetcher = new ItemStreamFetcher(activityService, new ActivityProperties());
	}

	private void emptyCategories(ItemCategory... categories) {
		for (ItemCategory category : categories) {
			lenient().when(activityService.fetchItems(REPO, category, null)).thenReturn(PageResult.empty());
		}
	}

	@Nested
	@DisplayName("Pagination")
	class PaginationTest {

		@Test
		@DisplayName("Should follow cursors until the last page")
		void shouldFollowCursors() {
			emptyCategories(ItemCategory.ISSUE, ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			PullRequest first = pullRequest(2, day(2024, 1, 2), day(2024, 1, 5));
			PullRequest second = pullRequest(1, day(2024, 1, 2), day(2024, 1, 4));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null))
				.thenReturn(new PageResult<>(List.of(first), "c1", true));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, "c1"))
				.thenReturn(new PageResult<>(List.of(second), null, false));

			List<Item> items = fetcher.fetch(REPO, HORIZON);

			assertThat(items).containsExactly(first, second);
		}

		@Test
		@DisplayName("Should stop a category at the first item older than the horizon")
		void shouldStopAtHorizon() {
			emptyCategories(ItemCategory.PULL_REQUEST, ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			Issue recent = issue(5, day(2023, 12, 1), day(2024, 1, 3), null, List.of());
			Issue old = issue(4, day(2023, 11, 1), day(2023, 12, 20), null, List.of());
			Issue older = issue(3, day(2023, 10, 1), day(2023, 12, 10), null, List.of());
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null))
				.thenReturn(new PageResult<>(List.of(recent, old, older), "c1", true));

			List<Item> items = fetcher.fetch(REPO, HORIZON);

			assertThat(items).containsExactly(recent);
			verify(activityService, never()).fetchItems(REPO, ItemCategory.ISSUE, "c1");
		}

		@Test
		@DisplayName("Should use creation time as the horizon for releases")
		void shouldUseCreationTimeForReleases() {
			emptyCategories(ItemCategory.PULL_REQUEST, ItemCategory.ISSUE, ItemCategory.DISCUSSION);
			Release release = release("v1.0", day(2024, 1, 2));
			Release old = release("v0.9", day(2023, 12, 2));
			when(activityService.fetchItems(REPO, ItemCategory.RELEASE, null))
				.thenReturn(new PageResult<>(List.of(release, old), "c1", true));

			assertThat(fetcher.fetch(REPO, HORIZON)).containsExactly(release);
		}

		@Test
		@DisplayName("Should interleave categories round by round")
		void shouldInterleaveCategories() {
			emptyCategories(ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null)).thenReturn(
					new PageResult<>(List.of(pullRequest(1, day(2024, 1, 2), day(2024, 1, 6))), "p1", true));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, "p1")).thenReturn(PageResult.empty());
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null)).thenReturn(new PageResult<>(
					List.of(issue(2, day(2024, 1, 2), day(2024, 1, 5), null, List.of())), "i1", true));
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, "i1")).thenReturn(PageResult.empty());

			fetcher.fetch(REPO, HORIZON);

			InOrder order = inOrder(activityService);
			order.verify(activityService).fetchItems(REPO, ItemCategory.PULL_REQUEST, null);
			order.verify(activityService).fetchItems(REPO, ItemCategory.ISSUE, null);
			order.verify(activityService).fetchItems(REPO, ItemCategory.PULL_REQUEST, "p1");
			order.verify(activityService).fetchItems(REPO, ItemCategory.ISSUE, "i1");
		}

	}

	@Nested
	@DisplayName("Failure isolation")
	class FailureTest {

		@Test
		@DisplayName("Should keep other categories when one category fails")
		void shouldIsolateFailingCategory() {
			emptyCategories(ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			PullRequest pr = pullRequest(1, day(2024, 1, 2), day(2024, 1, 6));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null))
				.thenReturn(new PageResult<>(List.of(pr), "p1", true));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, "p1"))
				.thenThrow(new QueryException("timeout"));
			Issue issue = issue(2, day(2024, 1, 2), day(2024, 1, 5), null, List.of());
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null))
				.thenReturn(new PageResult<>(List.of(issue), "i1", true));
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, "i1")).thenReturn(PageResult.empty());

			List<Item> items = fetcher.fetch(REPO, HORIZON);

			assertThat(items).containsExactly(pr, issue);
			verify(activityService, times(2)).fetchItems(eq(REPO), eq(ItemCategory.PULL_REQUEST), any());
		}

		@Test
		@DisplayName("Should record a failing category and skip categories that failed before")
		void shouldRememberFailedCategories() {
			emptyCategories(ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null)).thenThrow(new QueryException("timeout"));
			Set<ItemCategory> failed = EnumSet.of(ItemCategory.PULL_REQUEST);

			List<Item> items = fetcher.fetch(REPO, HORIZON, () -> false, failed);

			assertThat(items).isEmpty();
			assertThat(failed).containsExactlyInAnyOrder(ItemCategory.PULL_REQUEST, ItemCategory.ISSUE);
			verify(activityService, never()).fetchItems(eq(REPO), eq(ItemCategory.PULL_REQUEST), any());
		}

	}

	@Nested
	@DisplayName("Ordering and filtering")
	class OrderingTest {

		@Test
		@DisplayName("Should sort across categories by update time, most recent first")
		void shouldSortAcrossCategories() {
			emptyCategories(ItemCategory.DISCUSSION);
			PullRequest pr = pullRequest(1, day(2024, 1, 2), day(2024, 1, 3));
			Issue issue = issue(2, day(2024, 1, 2), day(2024, 1, 6), null, List.of());
			Release release = release("v1.0", day(2024, 1, 4));
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null))
				.thenReturn(new PageResult<>(List.of(pr), null, false));
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null))
				.thenReturn(new PageResult<>(List.of(issue), null, false));
			when(activityService.fetchItems(REPO, ItemCategory.RELEASE, null))
				.thenReturn(new PageResult<>(List.of(release), null, false));

			assertThat(fetcher.fetch(REPO, HORIZON)).containsExactly(issue, release, pr);
		}

		@Test
		@DisplayName("Should keep category order for equal update times")
		void shouldBeStable() {
			emptyCategories(ItemCategory.RELEASE, ItemCategory.DISCUSSION);
			PullRequest pr = pullRequest(1, day(2024, 1, 2), day(2024, 1, 5));
			Issue issue = issue(2, day(2024, 1, 2), day(2024, 1, 5), null, List.of());
			when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null))
				.thenReturn(new PageResult<>(List.of(pr), null, false));
			when(activityService.fetchItems(REPO, ItemCategory.ISSUE, null))
				.thenReturn(new PageResult<>(List.of(issue), null, false));

			assertThat(fetcher.fetch(REPO, HORIZON)).containsExactly(pr, issue);
		}

		@Test
		@DisplayName("Should leave out previously published reports")
		void shouldSkipPublishedReports() {
			emptyCategories(ItemCategory.PULL_REQUEST, ItemCategory.ISSUE, ItemCategory.RELEASE);
			String reportBody = ReportFooter
				.forWindow(FIRST_WEEK, "https://github.com/spring-ai-community/github-activity-summary", "none")
				.appendTo("Weekly summary");
			Discussion report = discussion(1, reportBody, day(2024, 1, 8), day(2024, 1, 8));
			Discussion question = discussion(2, "How do I configure this?", day(2024, 1, 3), day(2024, 1, 4));
			when(activityService.fetchItems(REPO, ItemCategory.DISCUSSION, null))
				.thenReturn(new PageResult<>(List.of(report, question), null, false));

			assertThat(fetcher.fetch(REPO, HORIZON)).containsExactly(question);
		}

	}

	@Test
	@DisplayName("Should stop paginating when cancelled and keep completed rounds")
	void shouldStopWhenCancelled() {
		emptyCategories(ItemCategory.ISSUE, ItemCategory.RELEASE, ItemCategory.DISCUSSION);
		PullRequest pr = pullRequest(1, day(2024, 1, 2), day(2024, 1, 5));
		when(activityService.fetchItems(REPO, ItemCategory.PULL_REQUEST, null))
			.thenReturn(new PageResult<>(List.of(pr), "p1", true));
		AtomicInteger checks = new AtomicInteger();

		List<Item> items = fetcher.fetch(REPO, HORIZON, () -> checks.incrementAndGet() > 1);

		assertThat(items).containsExactly(pr);
		verify(activityService, never()).fetchItems(REPO, ItemCategory.PULL_REQUEST, "p1");
	}

}
