package works.spectra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.spectra.exceptions.SpecFailedError;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.spectra.Spectra.asserting;
import static works.spectra.Spectra.assertThat;

class SpectraTest {

	@Test
	void assertThat_comparableSubject_givesOrderedSpec() {
		Spec<Integer> spec = assertThat(7);
		assertInstanceOf(OrderedSpec.class, spec);
		assertEquals(Integer.valueOf(7), spec.subject());
		assertNull(spec.description());
	}

	@Test
	void assertThat_otherSubject_givesPlainSpec() {
		Object subject = new Object();
		Spec<Object> spec = assertThat(subject);
		assertEquals(Spec.class, spec.getClass());
		assertSame(subject, spec.subject());
	}

	@Test
	void asserting_describesOrderedChain() {
		OrderedSpec<Integer> spec = asserting("retry count").that(4);
		assertEquals("retry count", spec.description());
		SpecFailedError e = assertThrows(SpecFailedError.class, () -> spec.isLessThanOrEqualTo(3));
		assertEquals("\n\tretry count:\n\texpected: value less than or equal to <3>\n\t but was: <4>", e.getMessage());
	}

	@Test
	void asserting_passingChain_isSilent() {
		asserting("retry count").that(2).isGreaterThan(0).isLessThanOrEqualTo(3);
	}

	@Test
	void asserting_describesPlainChain() {
		Object subject = new Object();
		Spec<Object> spec = asserting("anything").that(subject);
		assertEquals(Spec.class, spec.getClass());
		assertEquals("anything", spec.description());
	}

	@ParameterizedTest
	@NullSource
	@ValueSource(strings = {"", " ", "\t\n"})
	void asserting_blankDescription_throws(String description) {
		assertThrows(IllegalArgumentException.class, () -> asserting(description));
	}
}
