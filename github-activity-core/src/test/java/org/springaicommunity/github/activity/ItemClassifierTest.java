package org.springaicommunity.github.activity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.activity.TestItems.*;

@DisplayName("ItemClassifier Tests")
class ItemClassifierTest {

	private final ItemClassifier classifier = new ItemClassifier();

	@Nested
	@DisplayName("Releases")
	class ReleaseTest {

		@Test
		@DisplayName("Should include a release created in the window")
		void shouldIncludeReleaseCreatedInWindow() {
			assertThat(classifier.classify(release("v1.0", day(2024, 1, 3)), FIRST_WEEK))
				.contains(InclusionReason.RELEASE_CREATED);
		}

		@Test
		@DisplayName("Should exclude releases created outside the window")
		void shouldExcludeReleaseOutsideWindow() {
			assertThat(classifier.shouldInclude(release("v0.9", day(2023, 12, 31)), FIRST_WEEK)).isFalse();
			assertThat(classifier.shouldInclude(release("v1.1", at("2024-01-08T00:00:00")), FIRST_WEEK)).isFalse();
		}

	}

	@Nested
	@DisplayName("Creation and update")
	class CreationTest {

		@Test
		@DisplayName("Should include a pull request created in the window without comments")
		void shouldIncludeCreatedOnly() {
			PullRequest pr = pullRequest(1, day(2024, 1, 3), day(2024, 1, 3));

			assertThat(classifier.classify(pr, FIRST_WEEK)).contains(InclusionReason.UPDATED_IN_WINDOW);
		}

		@Test
		@DisplayName("Should include an item created in the window and updated after it")
		void shouldIncludeCreatedInWindowUpdatedLater() {
			PullRequest pr = pullRequest(1, day(2024, 1, 3), day(2024, 2, 1));

			assertThat(classifier.classify(pr, FIRST_WEEK)).contains(InclusionReason.CREATED_IN_WINDOW);
		}

		@Test
		@DisplayName("Should exclude an item created at the window end")
		void shouldExcludeCreatedAtEnd() {
			Issue issue = issue(2, at("2024-01-08T00:00:00"), at("2024-01-08T00:00:00"), null, List.of());

			assertThat(classifier.classify(issue, FIRST_WEEK)).isEmpty();
		}

		@Test
		@DisplayName("Should include an old item updated in the window")
		void shouldIncludeOldItemUpdatedInWindow() {
			Comment comment = comment("alice", "Looks good", day(2024, 1, 5));
			PullRequest pr = pullRequest(1, day(2023, 12, 1), day(2024, 1, 5), null, null, List.of(comment),
					List.of());

			assertThat(classifier.classify(pr, FIRST_WEEK)).contains(InclusionReason.UPDATED_IN_WINDOW);
		}

	}

	@Nested
	@DisplayName("State transitions")
	class TransitionTest {

		@Test
		@DisplayName("Should include an item closed in the window")
		void shouldIncludeClosedInWindow() {
			Issue issue = issue(3, day(2023, 11, 1), day(2024, 2, 1), day(2024, 1, 4), List.of());

			assertThat(classifier.classify(issue, FIRST_WEEK)).contains(InclusionReason.CLOSED_IN_WINDOW);
		}

		@Test
		@DisplayName("Should exclude an item closed before the window even with comments in it")
		void shouldExcludeClosedBeforeWindow() {
			Comment late = comment("bob", "Any news?", day(2024, 1, 4));
			Issue issue = issue(3, day(2023, 11, 1), day(2024, 2, 1), day(2023, 12, 20), List.of(late));

			assertThat(classifier.classify(issue, FIRST_WEEK)).isEmpty();
		}

		@Test
		@DisplayName("Should include a pull request merged in the window")
		void shouldIncludeMergedInWindow() {
			PullRequest pr = pullRequest(4, day(2023, 11, 1), day(2024, 2, 1), day(2024, 1, 2), null, List.of(),
					List.of());

			assertThat(classifier.classify(pr, FIRST_WEEK)).contains(InclusionReason.MERGED_IN_WINDOW);
		}

		@Test
		@DisplayName("Should exclude a pull request merged before the window")
		void shouldExcludeMergedBeforeWindow() {
			Commit commit = commit("Late fixup", day(2024, 1, 3));
			PullRequest pr = pullRequest(4, day(2023, 11, 1), day(2024, 2, 1), day(2023, 12, 30), null, List.of(),
					List.of(commit));

			assertThat(classifier.classify(pr, FIRST_WEEK)).isEmpty();
		}

	}

	@Nested
	@DisplayName("Nested activity")
	class NestedActivityTest {

		@Test
		@DisplayName("Should include an item with a comment in the window")
		void shouldIncludeCommentInWindow() {
			Comment comment = comment("carol", "Ping", day(2024, 1, 6));
			Issue issue = issue(5, day(2023, 10, 1), day(2024, 2, 1), null, List.of(comment));

			assertThat(classifier.classify(issue, FIRST_WEEK)).contains(InclusionReason.COMMENT_IN_WINDOW);
		}

		@Test
		@DisplayName("Should include a pull request with a commit in the window")
		void shouldIncludeCommitInWindow() {
			Commit commit = commit("Address review", day(2024, 1, 6));
			PullRequest pr = pullRequest(6, day(2023, 10, 1), day(2024, 2, 1), null, null, List.of(),
					List.of(commit));

			assertThat(classifier.classify(pr, FIRST_WEEK)).contains(InclusionReason.COMMIT_IN_WINDOW);
		}

		@Test
		@DisplayName("Should exclude an item with no activity in the window")
		void shouldExcludeInactiveItem() {
			Comment old = comment("dave", "Old", day(2023, 12, 1));
			Issue issue = issue(7, day(2023, 10, 1), day(2024, 2, 1), null, List.of(old));

			assertThat(classifier.shouldInclude(issue, FIRST_WEEK)).isFalse();
		}

	}

}
