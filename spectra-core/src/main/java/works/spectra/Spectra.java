package works.spectra;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry points for building assertion chains.
 *
 * <pre>{@code
 * import static works.spectra.Spectra.assertThat;
 *
 * assertThat(retries).isLessThanOrEqualTo(3);
 * asserting("queue depth").that(depth).isGreaterThan(0);
 * }</pre>
 *
 * Subjects whose type is {@link Comparable} get an {@link OrderedSpec};
 * anything else gets a plain {@link Spec}, for use by other predicate families.
 */
public final class Spectra {
	private Spectra() {}

	public static <T extends Comparable<? super T>> OrderedSpec<T> assertThat(@Nullable T subject) {
		return new OrderedSpec<>(subject, null);
	}

	public static <T> Spec<T> assertThat(@Nullable T subject) {
		return new Spec<>(subject, null);
	}

	/**
	 * Starts a chain whose failure diagnostics are headed by {@code description}.
	 *
	 * @throws IllegalArgumentException if {@code description} is null or blank
	 */
	public static Description asserting(String description) {
		if (description == null || description.isBlank()) {
			throw new IllegalArgumentException("Description can't be blank");
		}
		return new Description(description);
	}

	public static final class Description {
		@NotNull
		final String value;

		private Description(@NotNull String value) {
			this.value = value;
		}

		public <T extends Comparable<? super T>> OrderedSpec<T> that(@Nullable T subject) {
			return new OrderedSpec<>(subject, value);
		}

		public <T> Spec<T> that(@Nullable T subject) {
			return new Spec<>(subject, value);
		}

		@Override
		public String toString() {
			return value;
		}
	}
}
