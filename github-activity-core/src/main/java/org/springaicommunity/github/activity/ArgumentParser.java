package org.springaicommunity.github.activity;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the activity summary application.
 */
public class ArgumentParser {

	private final ActivityProperties defaultProperties;

	public ArgumentParser(ActivityProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++; // Skip next argument since we consumed it
					break;

				case "-c", "--category":
					config.category = getRequiredValue(args, i, "category");
					i++;
					break;

				case "--start-date":
					String startDate = getRequiredValue(args, i, "start-date");
					try {
						config.startDate = LocalDate.parse(startDate);
					}
					catch (DateTimeParseException e) {
						throw new IllegalArgumentException(
								"Invalid start date '" + startDate + "': must be YYYY-MM-DD format");
					}
					i++;
					break;

				case "--cache":
					config.cache = true;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--summary-file":
					config.summaryFile = getRequiredValue(args, i, "summary-file");
					i++;
					break;

				case "-m", "--model":
					config.model = getRequiredValue(args, i, "model");
					i++;
					break;

				case "--window-step":
					config.windowStepDays = parsePositive(getRequiredValue(args, i, "window-step"), "window step");
					i++;
					break;

				case "--min-items":
					config.minItems = parseNonNegative(getRequiredValue(args, i, "min-items"), "min items");
					i++;
					break;

				case "--min-activities":
					config.minActivities = parseNonNegative(getRequiredValue(args, i, "min-activities"),
							"min activities");
					i++;
					break;

				case "--summary-count":
					config.summaryCount = parsePositive(getRequiredValue(args, i, "summary-count"), "summary count");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-activity-summary [OPTIONS]\n");
		help.append("\n");
		help.append("Summarize recent pull requests, issues, releases and discussions of a GitHub repository.\n");
		help.append("The report window starts the day after the last published report and grows\n");
		help.append("until it holds enough activity or reaches today.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("    -r, --repo REPO          Repository in format owner/repo (required)\n");
		help.append("    -c, --category NAME      Discussion category of previous and new reports\n");
		help.append("    --start-date DATE        First day of the report (YYYY-MM-DD), overrides continuation\n");
		help.append("    --cache                  Memoize GraphQL responses during the run\n");
		help.append("    -d, --dry-run            Do not publish a discussion\n");
		help.append("    -v, --verbose            Enable verbose logging\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    -o, --output FILE        Write the rendered report to FILE ('-' for stdout)\n");
		help.append("    --summary-file FILE      Publish the content of FILE instead of the rendered report\n");
		help.append("    -m, --model NAME         Name of the model that wrote the summary, recorded in the\n");
		help.append("                             report footer (default: none)\n");
		help.append("\n");
		help.append("WINDOW OPTIONS:\n");
		help.append("    --window-step DAYS       Days added to the window per expansion (default: ")
			.append(defaultProperties.getWindowStepDays())
			.append(")\n");
		help.append("    --min-items N            Items needed for a report (default: ")
			.append(defaultProperties.getMinItems())
			.append(")\n");
		help.append("    --min-activities N       Comments and commits needed for a report (default: ")
			.append(defaultProperties.getMinActivities())
			.append(")\n");
		help.append("    --summary-count N        Previous reports to read (default: ")
			.append(defaultProperties.getSummaryCount())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN             GitHub personal access token (required)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-activity-summary --repo spring-projects/spring-ai --dry-run -o -\n");
		help.append("    github-activity-summary --repo owner/repo --category \"Activity reports\"\n");
		help.append("    github-activity-summary --repo owner/repo --start-date 2024-01-01 --window-step 14\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get("GITHUB_TOKEN");
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositive(String value, String name) {
		int parsed = parseInt(value, name, "a positive integer");
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

	private static int parseNonNegative(String value, String name) {
		int parsed = parseInt(value, name, "a non-negative integer");
		if (parsed < 0) {
			throw new IllegalArgumentException(
					"Invalid " + name + " '" + value + "': must be a non-negative integer");
		}
		return parsed;
	}

	private static int parseInt(String value, String name, String expected) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be " + expected);
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.repository == null || config.repository.trim().isEmpty()) {
			errors.add("Repository is required (--repo owner/repo)");
		}
		else if (!config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
		}

		if (config.category != null && config.category.trim().isEmpty()) {
			errors.add("Category cannot be blank");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
