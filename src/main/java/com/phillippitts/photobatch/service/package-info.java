/**
 * Service layer of the batch transformer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.scan} - directory walk, same-name grouping, output path mapping</li>
 *   <li>{@code service.codec} - decode/encode boundary (ImageIO, Commons Imaging, dcraw)</li>
 *   <li>{@code service.pipeline} - per-file transforms for standard images and RAW files</li>
 *   <li>{@code service.schedule} - bounded-concurrency dispatch of the standard stage</li>
 *   <li>{@code service.workers} - CPU sampling and adaptive worker sizing</li>
 *   <li>{@code service.progress} - run counters, progress and log channels, error report</li>
 *   <li>{@code service.batch} - run orchestration</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans; per-run state travels in a
 *       {@link com.phillippitts.photobatch.domain.RunState} argument</li>
 *   <li>Services throw the unchecked exceptions of {@code com.phillippitts.photobatch.exception}</li>
 *   <li>Services use constructor injection</li>
 * </ul>
 */
package com.phillippitts.photobatch.service;
