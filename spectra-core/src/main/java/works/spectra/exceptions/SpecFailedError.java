package works.spectra.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when an assertion does not hold.
 * <p>
 * This is an {@link AssertionError} so that test runners report it as a failed test
 * rather than an errored one. It is never caught by the library itself.
 */
public class SpecFailedError extends AssertionError {
	private final String description;
	private final String expected;
	private final String actual;

	public @Nullable String description() {
		return this.description;
	}

	public @Nullable String expected() {
		return this.expected;
	}

	public @Nullable String actual() {
		return this.actual;
	}

	public SpecFailedError(@Nullable String description, @Nullable String expected, @Nullable String actual) {
		super(fullMessage(description, "expected: " + orEmpty(expected) + "\n\t but was: " + orEmpty(actual)));
		this.description = description;
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * For failures that have no expected/actual pair.
	 */
	public SpecFailedError(@Nullable String description, String message) {
		super(fullMessage(description, message));
		this.description = description;
		this.expected = null;
		this.actual = null;
	}

	private static String fullMessage(@Nullable String description, String body) {
		String prefix = (description == null) ? "" : "\n\t" + description + ":";
		return prefix + "\n\t" + body;
	}

	private static String orEmpty(@Nullable String text) {
		return (text == null) ? "" : text;
	}
}
