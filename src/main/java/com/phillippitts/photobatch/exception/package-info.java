/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.photobatch.exception.PhotoBatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.photobatch.exception.DecodeException},
 *       {@link com.phillippitts.photobatch.exception.ResizeException},
 *       {@link com.phillippitts.photobatch.exception.EncodeException},
 *       {@link com.phillippitts.photobatch.exception.OutputWriteException} - per-file failures of
 *       the standard pipeline, retried before they are recorded</li>
 *   <li>{@link com.phillippitts.photobatch.exception.ColorProfileException} - recovered locally,
 *       never recorded</li>
 *   <li>{@link com.phillippitts.photobatch.exception.RawDecodeException} - per-file RAW failure,
 *       single attempt</li>
 *   <li>{@link com.phillippitts.photobatch.exception.RawUnavailableException} - disables the RAW
 *       stage for the run</li>
 *   <li>{@link com.phillippitts.photobatch.exception.CpuSampleException} - replaced by a neutral
 *       load value</li>
 * </ul>
 *
 * <p>No per-file exception escapes the pipeline boundary; each becomes one error-log entry.
 */
package com.phillippitts.photobatch.exception;
