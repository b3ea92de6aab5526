/**
 * Camera RAW decoding through the external {@code dcraw} binary.
 *
 * <p>The decoder runs one process per call: {@code -c -w -q 3 -g 2.2 4.5 -T} for pixels (8-bit TIFF on
 * stdout), {@code -i -v} for capture metadata. Output streams are drained by gobbler threads and
 * every process is bounded by {@code photobatch.raw.timeout-seconds}. Tests replace the process
 * launcher through {@link com.phillippitts.photobatch.service.codec.raw.ProcessFactory}.
 */
package com.phillippitts.photobatch.service.codec.raw;
