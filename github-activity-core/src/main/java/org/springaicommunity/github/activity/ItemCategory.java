package org.springaicommunity.github.activity;

/**
 * The category tag of an {@link Item}. Each category is paginated independently.
 */
public enum ItemCategory {

	PULL_REQUEST("pullRequests", "Pull requests"),

	ISSUE("issues", "Issues"),

	RELEASE("releases", "Releases"),

	DISCUSSION("discussions", "Discussions");

	private final String connectionName;

	private final String label;

	ItemCategory(String connectionName, String label) {
		this.connectionName = connectionName;
		this.label = label;
	}

	/**
	 * Name of the repository connection holding items of this category.
	 * @return GraphQL connection field name
	 */
	public String connectionName() {
		return connectionName;
	}

	/**
	 * Human readable plural label.
	 * @return label used in logs and reports
	 */
	public String label() {
		return label;
	}

}
