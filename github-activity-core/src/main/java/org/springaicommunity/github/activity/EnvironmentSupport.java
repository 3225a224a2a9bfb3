package org.springaicommunity.github.activity;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables from the system environment and {@code .env} files. The
 * {@code .env} files are loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	public static @Nullable String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

}
