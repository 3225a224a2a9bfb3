package org.springaicommunity.github.activity;

/**
 * State of the adaptive report window.
 */
public enum WindowState {

	/**
	 * The window is still growing towards today.
	 */
	EXPANDING,

	/**
	 * The window contains enough activity for a report.
	 */
	SATISFIED,

	/**
	 * The window reached today without enough activity. No report should be produced.
	 */
	EXHAUSTED;

	public boolean isTerminal() {
		return this != EXPANDING;
	}

}
