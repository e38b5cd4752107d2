package works.spectra;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectra.util.DebugFormat;
import works.spectra.util.PartialOrder;

/**
 * Relational assertions for subjects that have an ordering.
 * <p>
 * Comparisons follow {@link PartialOrder}: when the subject and the other value
 * are incomparable ({@code NaN}, or a {@code null} on either side),
 * every predicate here fails, because none of the relations can be established.
 * <p>
 * Each predicate returns this same object, so checks can be chained:
 *
 * <pre>{@code
 * assertThat(latency).isGreaterThanOrEqualTo(0L).isLessThan(timeout);
 * }</pre>
 *
 * @param <T> the type of the subject
 */
public class OrderedSpec<T extends Comparable<? super T>> extends Spec<T> {

	protected OrderedSpec(@Nullable T subject, @Nullable String description) {
		super(subject, description);
	}

	@Override
	public OrderedSpec<T> withExpected(@Nullable String text) {
		super.withExpected(text);
		return this;
	}

	@Override
	public OrderedSpec<T> withActual(@Nullable String text) {
		super.withActual(text);
		return this;
	}

	/**
	 * Asserts that the subject is less than {@code other}.
	 *
	 * <pre>{@code
	 * assertThat(1).isLessThan(2);
	 * }</pre>
	 */
	public OrderedSpec<T> isLessThan(@Nullable T other) {
		T subject = subject();
		LOGGER.trace("assert that {} is less than {}", subject, other);
		if (!PartialOrder.lessThan(subject, other)) {
			withExpected("value less than " + bracketed(other))
				.withActual(bracketed(subject))
				.fail();
		}
		return this;
	}

	/**
	 * Asserts that the subject is less than or equal to {@code other}.
	 *
	 * <pre>{@code
	 * assertThat(2).isLessThanOrEqualTo(2);
	 * }</pre>
	 */
	public OrderedSpec<T> isLessThanOrEqualTo(@Nullable T other) {
		T subject = subject();
		LOGGER.trace("assert that {} is less than or equal to {}", subject, other);
		if (!PartialOrder.lessThanOrEqualTo(subject, other)) {
			withExpected("value less than or equal to " + bracketed(other))
				.withActual(bracketed(subject))
				.fail();
		}
		return this;
	}

	/**
	 * Asserts that the subject is greater than {@code other}.
	 *
	 * <pre>{@code
	 * assertThat(2).isGreaterThan(1);
	 * }</pre>
	 */
	public OrderedSpec<T> isGreaterThan(@Nullable T other) {
		T subject = subject();
		LOGGER.trace("assert that {} is greater than {}", subject, other);
		if (!PartialOrder.greaterThan(subject, other)) {
			withExpected("value greater than " + bracketed(other))
				.withActual(bracketed(subject))
				.fail();
		}
		return this;
	}

	/**
	 * Asserts that the subject is greater than or equal to {@code other}.
	 *
	 * <pre>{@code
	 * assertThat(2).isGreaterThanOrEqualTo(1);
	 * }</pre>
	 */
	public OrderedSpec<T> isGreaterThanOrEqualTo(@Nullable T other) {
		T subject = subject();
		LOGGER.trace("assert that {} is greater than or equal to {}", subject, other);
		if (!PartialOrder.greaterThanOrEqualTo(subject, other)) {
			withExpected("value greater than or equal to " + bracketed(other))
				.withActual(bracketed(subject))
				.fail();
		}
		return this;
	}

	private static String bracketed(@Nullable Object value) {
		return "<" + DebugFormat.render(value) + ">";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderedSpec.class);
}
