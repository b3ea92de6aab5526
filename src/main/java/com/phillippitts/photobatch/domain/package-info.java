/**
 * Domain models of a batch run.
 *
 * <p>Scan-time values ({@link com.phillippitts.photobatch.domain.FileGroup},
 * {@link com.phillippitts.photobatch.domain.ScanResult}) and run settings
 * ({@link com.phillippitts.photobatch.domain.ProcessingConfig}) are immutable records that
 * validate in their constructors. {@link com.phillippitts.photobatch.domain.RunState} is the one
 * mutable, run-scoped object; it is passed explicitly rather than held globally.
 */
package com.phillippitts.photobatch.domain;
