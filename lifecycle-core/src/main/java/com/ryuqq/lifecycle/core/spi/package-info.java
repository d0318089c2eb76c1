/**
 * Service Provider Interface for resource types.
 *
 * <p>Concrete resource plugins implement {@link com.ryuqq.lifecycle.core.spi.ResourceHandler}
 * and are looked up through {@link com.ryuqq.lifecycle.core.spi.ResourceHandlerRegistry}.
 * Failures cross this boundary as {@link com.ryuqq.lifecycle.core.spi.TransportException}
 * or {@link com.ryuqq.lifecycle.core.spi.RemoteNotFoundException}.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.spi;
