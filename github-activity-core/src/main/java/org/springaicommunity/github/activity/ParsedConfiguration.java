package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Repository settings
	public @Nullable String repository;

	// Discussion category holding previous reports; null disables continuation and
	// publishing
	public @Nullable String category;

	public @Nullable LocalDate startDate;

	// Mode flags
	public boolean cache;

	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Output options
	public @Nullable String outputFile = null; // "-" writes to stdout

	public @Nullable String summaryFile = null; // published instead of the rendered report

	public String model = "none"; // recorded in the report footer

	// Window policy
	public int windowStepDays;

	public int minItems;

	public int minActivities;

	public int summaryCount;

	public ParsedConfiguration(ActivityProperties defaultProperties) {
		this.cache = defaultProperties.isCacheEnabled();
		this.verbose = defaultProperties.isVerbose();
		this.windowStepDays = defaultProperties.getWindowStepDays();
		this.minItems = defaultProperties.getMinItems();
		this.minActivities = defaultProperties.getMinActivities();
		this.summaryCount = defaultProperties.getSummaryCount();
	}

	/**
	 * Copy the parsed values onto a properties instance.
	 * @param properties properties to update
	 */
	public void applyTo(ActivityProperties properties) {
		properties.setCacheEnabled(cache);
		properties.setVerbose(verbose);
		properties.setWindowStepDays(windowStepDays);
		properties.setMinItems(minItems);
		properties.setMinActivities(minActivities);
		properties.setSummaryCount(summaryCount);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repository='" + repository + '\'' + ", category='" + category + '\''
				+ ", startDate=" + startDate + ", cache=" + cache + ", dryRun=" + dryRun + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + ", outputFile='" + outputFile + '\'' + ", summaryFile='"
				+ summaryFile + '\'' + ", model='" + model + '\'' + ", windowStepDays=" + windowStepDays
				+ ", minItems=" + minItems + ", minActivities=" + minActivities + ", summaryCount=" + summaryCount
				+ '}';
	}

}
