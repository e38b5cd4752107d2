package works.spectra;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectra.exceptions.SpecFailedError;
import works.spectra.util.DebugFormat;

/**
 * Holds the subject of one assertion chain and the diagnostics
 * accumulated while checking it.
 * <p>
 * Predicate families extend this class. A predicate that finds its condition
 * unmet records what it wanted with {@link #withExpected}, what it saw with
 * {@link #withActual}, and then calls {@link #fail}.
 * Both texts should be set before failing; one that isn't renders as empty.
 * <p>
 * The subject is fixed at construction. Only the two diagnostic texts change,
 * and only on the way to a failure.
 * Instances are confined to the thread running the assertion chain.
 *
 * @param <T> the type of the subject
 */
public class Spec<T> {
	private final T subject;
	private final String description;
	private String expected;
	private String actual;

	protected Spec(@Nullable T subject, @Nullable String description) {
		this.subject = subject;
		this.description = description;
	}

	public @Nullable T subject() {
		return subject;
	}

	/**
	 * @return the text supplied to {@link Spectra#asserting}, or null if there was none
	 */
	public @Nullable String description() {
		return description;
	}

	/**
	 * Overwrites any expectation text set earlier in this chain.
	 */
	public Spec<T> withExpected(@Nullable String text) {
		this.expected = text;
		return this;
	}

	/**
	 * Overwrites any actual-value text set earlier in this chain.
	 */
	public Spec<T> withActual(@Nullable String text) {
		this.actual = text;
		return this;
	}

	/**
	 * Aborts the current test with a two-line diagnostic built from
	 * the {@link #withExpected expected} and {@link #withActual actual} texts:
	 *
	 * <pre>
	 * \n\texpected: &lt;expected&gt;
	 * \n\t but was: &lt;actual&gt;
	 * </pre>
	 *
	 * If this chain has a {@link #description() description},
	 * the diagnostic is preceded by {@code \n\t<description>:}.
	 *
	 * @throws SpecFailedError always
	 */
	public void fail() {
		LOGGER.debug("Assertion failed on {}: expected {} but was {}", description, expected, actual);
		throw new SpecFailedError(description, expected, actual);
	}

	/**
	 * Aborts the current test with a free-form diagnostic,
	 * for predicates that have no natural expected/actual pair.
	 *
	 * @throws SpecFailedError always
	 */
	public void failWithMessage(String message) {
		LOGGER.debug("Assertion failed on {}: {}", description, message);
		throw new SpecFailedError(description, message);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(subject=" + DebugFormat.render(subject) + ", description=" + description + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Spec.class);
}
