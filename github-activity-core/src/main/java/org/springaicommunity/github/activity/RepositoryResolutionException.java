package org.springaicommunity.github.activity;

/**
 * Thrown when the target repository cannot be resolved. This is the only failure that
 * aborts an aggregation run.
 */
public class RepositoryResolutionException extends RuntimeException {

	public RepositoryResolutionException(String message) {
		super(message);
	}

	public RepositoryResolutionException(String message, Throwable cause) {
		super(message, cause);
	}

}
