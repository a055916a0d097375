/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Defines the collaborators the guard layer wraps but does not implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardmap.core.spi.OrderedContainer} - insertion-ordered hash map</li>
 *   <li>{@link com.ryuqq.guardmap.core.spi.AllocationHook} - allocation metering callback</li>
 *   <li>{@link com.ryuqq.guardmap.core.spi.EntrySizer} - per-entry byte accounting</li>
 *   <li>{@link com.ryuqq.guardmap.core.spi.Codec} - key/value byte encoding</li>
 *   <li>{@link com.ryuqq.guardmap.core.spi.TransferSink} /
 *       {@link com.ryuqq.guardmap.core.spi.TransferSource} - byte transports</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., guardmap-adapter-inmemory) provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author GuardMap Team
 */
package com.ryuqq.guardmap.core.spi;
