package org.springaicommunity.github.activity.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.activity.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * GitHub Activity Summary CLI Application
 *
 * Plain Java command-line application that aggregates the recent activity of a
 * repository, renders it as Markdown and optionally publishes it as a discussion. Uses
 * GitHubActivityBuilder for service wiring.
 *
 * Usage: java -jar github-activity-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication
 *
 * Exit codes: 0 when the run completes, whether or not a report was produced; 1 when the
 * run fails; 2 when the arguments are invalid.
 *
 * Examples: java -jar github-activity-cli.jar --repo spring-projects/spring-ai --dry-run
 * java -jar github-activity-cli.jar --repo owner/repo --category "Activity reports" java
 * -jar github-activity-cli.jar --repo owner/repo --start-date 2024-01-01 -o report.md
 */
public class GitHubActivityCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubActivityCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	private static final String STDOUT = "-";

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, properties -> GitHubActivityBuilder.create().tokenFromEnv().properties(properties));
	}

	/**
	 * Run with a custom builder factory.
	 * @param args command-line arguments
	 * @param builderFactory creates the service builder from the effective properties
	 * @return process exit code
	 */
	static int run(String[] args, Function<ActivityProperties, GitHubActivityBuilder> builderFactory) {
		ActivityProperties properties = new ActivityProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
			config.applyTo(properties);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config);

		try {
			return execute(config, properties, builderFactory.apply(properties));
		}
		catch (RepositoryResolutionException e) {
			logger.error("{}: {}", e.getMessage(), e.getCause() != null ? e.getCause().getMessage() : "unknown cause");
			return EXIT_FAILURE;
		}
		catch (IOException | RuntimeException e) {
			logger.error("Activity summary failed: {}", e.getMessage());
			logger.debug("Failure details", e);
			return EXIT_FAILURE;
		}
	}

	private static int execute(ParsedConfiguration config, ActivityProperties properties,
			GitHubActivityBuilder builder) throws IOException {
		RepositoryRef repository = RepositoryRef.parse(config.repository);
		ActivityAggregationService aggregationService = builder.buildAggregationService();

		ActivityReport report = aggregationService.aggregate(repository, config.category, config.startDate);
		if (!report.hasContent()) {
			logger.info("Not enough activity in {} to summarize. No report produced.", report.window());
			return EXIT_OK;
		}

		MarkdownReportRenderer renderer = new MarkdownReportRenderer(properties);
		String markdown = renderer.render(report);
		writeOutput(markdown, config.outputFile);

		if (config.category == null) {
			logger.info("No category provided. Discussion not created.");
			return EXIT_OK;
		}

		String content = config.summaryFile != null ? readSummary(config.summaryFile) : markdown;
		String body = ReportFooter.forWindow(report.window(), properties.getPoweredBy(), config.model)
			.appendTo(content);
		String title = renderer.title(report);

		if (config.dryRun) {
			logger.info("Dry run mode: Discussion with title '{}' would have been created in '{}'", title,
					config.category);
			logger.debug("Discussion body:\n{}", body);
			return EXIT_OK;
		}

		String url = builder.buildDiscussionPublisher().publish(report.repository(), config.category, title, body);
		logger.info("Published report: {}", url);
		return EXIT_OK;
	}

	private static void writeOutput(String content, String outputFile) throws IOException {
		if (outputFile == null || STDOUT.equals(outputFile)) {
			System.out.println(content);
			return;
		}
		Path path = Paths.get(outputFile);
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(path, content, StandardCharsets.UTF_8);
		logger.info("Report written to {}", path);
	}

	private static String readSummary(String summaryFile) throws IOException {
		Path path = Paths.get(summaryFile);
		logger.info("Publishing summary from {}", path);
		return Files.readString(path, StandardCharsets.UTF_8);
	}

	private static void enableDebugLogging() {
		Logger packageLogger = LoggerFactory.getLogger("org.springaicommunity.github.activity");
		if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Repository: {}", config.repository);
		logger.info("  Category: {}", config.category != null ? config.category : "(not set)");
		logger.info("  Start date: {}", config.startDate != null ? config.startDate : "(continue)");
		logger.info("  Cache: {}", config.cache);
		logger.info("  Dry run: {}", config.dryRun);
		logger.info("  Output: {}", config.outputFile != null ? config.outputFile : "(stdout)");
		logger.info("  Summary file: {}", config.summaryFile != null ? config.summaryFile : "(rendered report)");
		logger.info("  Window step: {} day(s)", config.windowStepDays);
		logger.info("  Thresholds: {} item(s), {} activities", config.minItems, config.minActivities);
		logger.info("  Summary count: {}", config.summaryCount);
	}

}
