package org.springaicommunity.github.activity;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the GitHub GraphQL endpoint using the JDK {@link HttpClient}.
 *
 * <p>
 * Reads the rate limit headers of every response and logs when few requests remain.
 * Non-2xx responses are mapped to {@link GitHubApiException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String DEFAULT_GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	private static final int LOW_RATE_LIMIT_THRESHOLD = 100;

	private final HttpClient httpClient;

	private final String token;

	private final URI endpoint;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_GRAPHQL_ENDPOINT);
	}

	public GitHubHttpClient(String token, String endpoint) {
		this.token = token;
		this.endpoint = URI.create(endpoint);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST GraphQL ({} bytes)", body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", "github-activity-summary")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("POST GraphQL completed in {}ms ({} bytes)", System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("POST GraphQL failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);

			if (remaining >= 0 && remaining < LOW_RATE_LIMIT_THRESHOLD) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}
			else if (remaining >= 0) {
				logger.debug("Rate limit: {}/{} remaining", remaining, limit);
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body());
			}
			else if (statusCode == 403) {
				String message = remaining == 0 ? "Rate limit exceeded. Resets at epoch: " + reset : "Forbidden";
				throw new GitHubApiException(message, statusCode, response.body());
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body());
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body());
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub API call fails at the HTTP level.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

	}

}
