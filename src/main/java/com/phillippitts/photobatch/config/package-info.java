/**
 * Application configuration: bound properties and the worker pool factory.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code photobatch.processing.*} and {@code photobatch.workers.*}</li>
 *   <li>{@code config.raw} - {@code photobatch.raw.*}, the external RAW decoder</li>
 * </ul>
 *
 * @see com.phillippitts.photobatch.config.WorkerPoolFactory
 */
package com.phillippitts.photobatch.config;
