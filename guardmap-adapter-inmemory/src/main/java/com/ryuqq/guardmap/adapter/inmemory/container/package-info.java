/**
 * In-memory ordered container adapter package.
 *
 * <p>Provides {@link com.ryuqq.guardmap.adapter.inmemory.container.InMemoryOrderedContainer},
 * a reference implementation of {@link com.ryuqq.guardmap.core.spi.OrderedContainer}
 * used by tests and single-process deployments.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Erase is O(N) to preserve insertion order</li>
 *   <li>Bucket count is simulated; lookups use {@link java.util.HashMap}</li>
 *   <li>Not thread-safe on its own</li>
 * </ul>
 *
 * @see com.ryuqq.guardmap.core.spi.OrderedContainer
 * @author GuardMap Team
 * @since 1.0.0
 */
package com.ryuqq.guardmap.adapter.inmemory.container;
