package org.springaicommunity.github.activity;

import java.util.regex.Pattern;

/**
 * Identifies a repository by owner and name.
 *
 * @param owner the owning user or organization
 * @param name the repository name
 */
public record RepositoryRef(String owner, String name) {

	private static final Pattern SEGMENT = Pattern.compile("[a-zA-Z0-9._-]+");

	public RepositoryRef {
		if (!SEGMENT.matcher(owner).matches() || !SEGMENT.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid repository '" + owner + "/" + name + "'");
		}
	}

	/**
	 * Parse an {@code owner/name} string.
	 * @param fullName repository in "owner/repo" format
	 * @return the repository reference
	 * @throws IllegalArgumentException if the format is invalid
	 */
	public static RepositoryRef parse(String fullName) {
		String[] parts = fullName.trim().split("/");
		if (parts.length != 2) {
			throw new IllegalArgumentException(
					"Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai'), got: " + fullName);
		}
		return new RepositoryRef(parts[0], parts[1]);
	}

	public String fullName() {
		return owner + "/" + name;
	}

	@Override
	public String toString() {
		return fullName();
	}

}
