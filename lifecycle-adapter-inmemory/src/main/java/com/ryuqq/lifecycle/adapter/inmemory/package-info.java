/**
 * In-memory reference backend.
 *
 * <p>Provides a simulated remote service and a {@link com.ryuqq.lifecycle.core.spi.ResourceHandler}
 * over it, for tests and local experiments.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.inmemory;
