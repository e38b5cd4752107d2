/**
 * The signal raised when an assertion does not hold.
 */
package works.spectra.exceptions;
