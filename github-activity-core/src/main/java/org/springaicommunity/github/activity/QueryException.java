package org.springaicommunity.github.activity;

/**
 * Thrown when a GraphQL query cannot be executed or the API reports errors for it.
 *
 * <p>
 * Covers both transport failures (network, authentication, HTTP status) and GraphQL
 * level errors. Callers paginating a single item category treat it as the end of that
 * category rather than the end of the run.
 */
public class QueryException extends RuntimeException {

	public QueryException(String message) {
		super(message);
	}

	public QueryException(String message, Throwable cause) {
		super(message, cause);
	}

}
