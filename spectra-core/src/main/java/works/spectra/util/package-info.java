/**
 * Stateless helpers shared by predicate families:
 * {@link works.spectra.util.DebugFormat} renders values for diagnostics, and
 * {@link works.spectra.util.PartialOrder} compares them without assuming a total order.
 */
package works.spectra.util;
