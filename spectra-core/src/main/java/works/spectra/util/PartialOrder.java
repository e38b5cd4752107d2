package works.spectra.util;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static works.spectra.util.PartialOrder.Ordering.EQUAL;
import static works.spectra.util.PartialOrder.Ordering.GREATER;
import static works.spectra.util.PartialOrder.Ordering.LESS;

/**
 * Compares values under partial-order semantics.
 * <p>
 * {@link Comparable#compareTo} imposes a total order even where the values
 * themselves don't have one: {@link Double#compareTo} puts {@code NaN} above
 * positive infinity and {@code -0.0} below {@code 0.0}.
 * Here, {@code Double} and {@code Float} are compared with the IEEE 754 operators instead,
 * so {@code NaN} is incomparable with everything (itself included)
 * and the two zeros are equal.
 * A {@code null} on either side is also incomparable.
 * <p>
 * The relational methods ({@link #lessThan} and friends) are fail-closed:
 * they return false whenever {@link #compare} is empty.
 */
public final class PartialOrder {
	private PartialOrder() {}

	public enum Ordering {
		LESS, EQUAL, GREATER;

		static Ordering of(int comparison) {
			if (comparison < 0) {
				return LESS;
			} else if (comparison > 0) {
				return GREATER;
			} else {
				return EQUAL;
			}
		}
	}

	/**
	 * @return the ordering of {@code left} relative to {@code right},
	 * or empty if the two are incomparable.
	 */
	public static <T extends Comparable<? super T>> Optional<Ordering> compare(@Nullable T left, @Nullable T right) {
		if (left == null || right == null) {
			return Optional.empty();
		} else if (left instanceof Double l && right instanceof Double r) {
			return compareFloatingPoint(l, r);
		} else if (left instanceof Float l && right instanceof Float r) {
			// Widening is exact, and preserves NaN and signed zero
			return compareFloatingPoint(l, r);
		} else {
			return Optional.of(Ordering.of(left.compareTo(right)));
		}
	}

	public static <T extends Comparable<? super T>> boolean lessThan(@Nullable T left, @Nullable T right) {
		return compare(left, right).map(o -> o == LESS).orElse(false);
	}

	public static <T extends Comparable<? super T>> boolean lessThanOrEqualTo(@Nullable T left, @Nullable T right) {
		return compare(left, right).map(o -> o != GREATER).orElse(false);
	}

	public static <T extends Comparable<? super T>> boolean greaterThan(@Nullable T left, @Nullable T right) {
		return compare(left, right).map(o -> o == GREATER).orElse(false);
	}

	public static <T extends Comparable<? super T>> boolean greaterThanOrEqualTo(@Nullable T left, @Nullable T right) {
		return compare(left, right).map(o -> o != LESS).orElse(false);
	}

	private static Optional<Ordering> compareFloatingPoint(double left, double right) {
		if (left < right) {
			return Optional.of(LESS);
		} else if (left > right) {
			return Optional.of(GREATER);
		} else if (left == right) {
			return Optional.of(EQUAL);
		} else {
			// At least one NaN
			return Optional.empty();
		}
	}
}
