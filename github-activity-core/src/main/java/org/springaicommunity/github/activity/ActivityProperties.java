package org.springaicommunity.github.activity;

/**
 * Configuration properties for activity aggregation.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubActivityBuilder}.
 * Command-line arguments parsed by {@link ArgumentParser} override these defaults.
 *
 * <p>
 * The window step and the content thresholds are policy values: they decide how quickly a
 * report window grows and how much activity makes a report worth publishing.
 */
public class ActivityProperties {

	/**
	 * Number of days added to the report window on each expansion.
	 */
	private int windowStepDays = 7;

	/**
	 * Minimum number of included items for a window to be considered satisfied.
	 */
	private int minItems = 2;

	/**
	 * Minimum number of comment and commit activities for a window to be considered
	 * satisfied.
	 */
	private int minActivities = 2;

	/**
	 * Items requested per page for each category.
	 */
	private int pageSize = 100;

	/**
	 * Comments or commits requested per item.
	 */
	private int nestedPageSize = 100;

	/**
	 * Number of previously published reports inspected for continuation.
	 */
	private int summaryCount = 3;

	/**
	 * GitHub GraphQL endpoint.
	 */
	private String graphqlEndpoint = GitHubHttpClient.DEFAULT_GRAPHQL_ENDPOINT;

	/**
	 * Memoize GraphQL responses for the lifetime of the process.
	 */
	private boolean cacheEnabled = false;

	/**
	 * Maximum number of memoized GraphQL responses.
	 */
	private int cacheSize = CachingGitHubClient.DEFAULT_MAX_ENTRIES;

	/**
	 * Marker that identifies reports published by this tool. Must appear in the
	 * {@code powered_by} field of a report footer.
	 */
	private String poweredByMarker = "github-activity-summary";

	/**
	 * Value written to the {@code powered_by} field of new report footers.
	 */
	private String poweredBy = "https://github.com/spring-ai-community/github-activity-summary";

	/**
	 * Maximum length of comment and commit messages in rendered reports.
	 */
	private int messageExcerptLength = 500;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public int getWindowStepDays() {
		return windowStepDays;
	}

	public void setWindowStepDays(int windowStepDays) {
		requirePositive("windowStepDays", windowStepDays);
		this.windowStepDays = windowStepDays;
	}

	public int getMinItems() {
		return minItems;
	}

	public void setMinItems(int minItems) {
		requireNonNegative("minItems", minItems);
		this.minItems = minItems;
	}

	public int getMinActivities() {
		return minActivities;
	}

	public void setMinActivities(int minActivities) {
		requireNonNegative("minActivities", minActivities);
		this.minActivities = minActivities;
	}

	public int getPageSize() {
		return pageSize;
	}

	/**
	 * Sets the number of items requested per page. GitHub caps connections at 100.
	 * @param pageSize items per page (1-100)
	 */
	public void setPageSize(int pageSize) {
		requireConnectionSize("pageSize", pageSize);
		this.pageSize = pageSize;
	}

	public int getNestedPageSize() {
		return nestedPageSize;
	}

	/**
	 * Sets the number of comments or commits requested per item.
	 * @param nestedPageSize nested items per item (1-100)
	 */
	public void setNestedPageSize(int nestedPageSize) {
		requireConnectionSize("nestedPageSize", nestedPageSize);
		this.nestedPageSize = nestedPageSize;
	}

	public int getSummaryCount() {
		return summaryCount;
	}

	public void setSummaryCount(int summaryCount) {
		requirePositive("summaryCount", summaryCount);
		this.summaryCount = summaryCount;
	}

	public String getGraphqlEndpoint() {
		return graphqlEndpoint;
	}

	public void setGraphqlEndpoint(String graphqlEndpoint) {
		this.graphqlEndpoint = graphqlEndpoint;
	}

	public boolean isCacheEnabled() {
		return cacheEnabled;
	}

	public void setCacheEnabled(boolean cacheEnabled) {
		this.cacheEnabled = cacheEnabled;
	}

	public int getCacheSize() {
		return cacheSize;
	}

	public void setCacheSize(int cacheSize) {
		requirePositive("cacheSize", cacheSize);
		this.cacheSize = cacheSize;
	}

	public String getPoweredByMarker() {
		return poweredByMarker;
	}

	public void setPoweredByMarker(String poweredByMarker) {
		this.poweredByMarker = poweredByMarker;
	}

	public String getPoweredBy() {
		return poweredBy;
	}

	public void setPoweredBy(String poweredBy) {
		this.poweredBy = poweredBy;
	}

	public int getMessageExcerptLength() {
		return messageExcerptLength;
	}

	public void setMessageExcerptLength(int messageExcerptLength) {
		requirePositive("messageExcerptLength", messageExcerptLength);
		this.messageExcerptLength = messageExcerptLength;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive, got: " + value);
		}
	}

	private static void requireNonNegative(String name, int value) {
		if (value < 0) {
			throw new IllegalArgumentException(name + " must not be negative, got: " + value);
		}
	}

	private static void requireConnectionSize(String name, int value) {
		if (value <= 0 || value > 100) {
			throw new IllegalArgumentException(name + " must be between 1 and 100, got: " + value);
		}
	}

}
