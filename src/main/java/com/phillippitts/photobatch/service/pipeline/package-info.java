/**
 * Per-file transforms. Pixel steps are stateless static helpers; the two pipelines are beans that
 * sequence them and own the retry and error-recording policy of their file kind.
 */
package com.phillippitts.photobatch.service.pipeline;
