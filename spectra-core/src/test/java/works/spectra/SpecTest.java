package works.spectra;

import org.junit.jupiter.api.Test;
import works.spectra.exceptions.SpecFailedError;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.spectra.Spectra.assertThat;

class SpecTest {
	record Point(int x, int y) {}

	@Test
	void subject_isHeldByReference() {
		Point point = new Point(1, 2);
		assertSame(point, assertThat(point).subject());
	}

	@Test
	void withExpectedAndActual_returnSameSpec() {
		Spec<Point> spec = assertThat(new Point(1, 2));
		assertSame(spec, spec.withExpected("something"));
		assertSame(spec, spec.withActual("something else"));
	}

	@Test
	void fail_formatsBothLines() {
		Spec<Point> spec = assertThat(new Point(1, 2))
			.withExpected("point on the diagonal")
			.withActual("<Point[x=1, y=2]>");
		SpecFailedError e = assertThrows(SpecFailedError.class, spec::fail);
		assertEquals("\n\texpected: point on the diagonal\n\t but was: <Point[x=1, y=2]>", e.getMessage());
		assertEquals("point on the diagonal", e.expected());
		assertEquals("<Point[x=1, y=2]>", e.actual());
		assertNull(e.description());
	}

	@Test
	void fail_laterTextOverwritesEarlier() {
		Spec<Point> spec = assertThat(new Point(0, 0))
			.withExpected("first")
			.withActual("first")
			.withExpected("second")
			.withActual("third");
		SpecFailedError e = assertThrows(SpecFailedError.class, spec::fail);
		assertEquals("\n\texpected: second\n\t but was: third", e.getMessage());
	}

	@Test
	void fail_unsetTextsAreEmpty() {
		SpecFailedError e = assertThrows(SpecFailedError.class, () -> assertThat(new Point(0, 0)).fail());
		assertEquals("\n\texpected: \n\t but was: ", e.getMessage());
		assertNull(e.expected());
		assertNull(e.actual());
	}

	@Test
	void fail_isAnAssertionError() {
		Spec<Object> spec = assertThat(new Object());
		assertThrows(AssertionError.class, spec::fail);
	}

	@Test
	void failWithMessage_usesMessageVerbatim() {
		SpecFailedError e = assertThrows(SpecFailedError.class, () -> assertThat(new Point(3, 4)).failWithMessage("point is not at the origin"));
		assertEquals("\n\tpoint is not at the origin", e.getMessage());
		assertNull(e.expected());
		assertNull(e.actual());
	}

	@Test
	void toString_rendersSubjectLikeDiagnostics() {
		assertEquals("Spec(subject=[1, 2], description=null)", assertThat(new int[] {1, 2}).toString());
		assertEquals("OrderedSpec(subject=\"a b\", description=sizes)", Spectra.asserting("sizes").that("a b").toString());
	}

	@Test
	void describedSpec_prefixesDescription() {
		Spec<Point> spec = Spectra.asserting("origin").that(new Point(3, 4))
			.withExpected("<Point[x=0, y=0]>")
			.withActual("<Point[x=3, y=4]>");
		SpecFailedError e = assertThrows(SpecFailedError.class, spec::fail);
		assertEquals("\n\torigin:\n\texpected: <Point[x=0, y=0]>\n\t but was: <Point[x=3, y=4]>", e.getMessage());
		assertEquals("origin", e.description());
	}

	@Test
	void describedSpec_prefixesFreeFormMessage() {
		SpecFailedError e = assertThrows(SpecFailedError.class, () ->
			Spectra.asserting("origin").that(new Point(3, 4)).failWithMessage("not at the origin"));
		assertEquals("\n\torigin:\n\tnot at the origin", e.getMessage());
	}
}
