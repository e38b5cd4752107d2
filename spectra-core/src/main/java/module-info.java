/**
 * Fluent assertions for ordered values.
 * <p>
 * Start with {@link works.spectra.Spectra} for the entry points.
 * Additional packages provide the failure type ({@link works.spectra.exceptions})
 * and the rendering and comparison helpers ({@link works.spectra.util}).
 */
module works.spectra.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	exports works.spectra;
	exports works.spectra.exceptions;
	exports works.spectra.util;
}
