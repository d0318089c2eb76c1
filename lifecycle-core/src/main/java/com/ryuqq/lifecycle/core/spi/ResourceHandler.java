package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.poll.PollResult;

import java.util.Map;
import java.util.Set;

/**
 * Resource type SPI: the polling protocol plus the mutating calls.
 *
 * <p>One implementation exists per resource type (firewall, firewall policy,
 * nested stack, ...). Implementations translate these calls into requests
 * against a concrete backend API. The engine never interprets backend-specific
 * vocabularies beyond the {@code <ACTION>_<PHASE>} status convention.</p>
 *
 * <p><strong>Error contract:</strong></p>
 * <ul>
 *   <li>{@link TransportException}: the call itself failed (connectivity, HTTP error)</li>
 *   <li>{@link RemoteNotFoundException}: the remote entity does not exist</li>
 * </ul>
 *
 * <p><strong>Call pattern per action:</strong></p>
 * <pre>
 * create/update/delete/suspend/resume  → exactly once per task (mutating)
 * probe                                → repeatedly until a terminal status (read-only)
 * show                                 → attribute lookups outside lifecycle actions
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: calls for different resources may come from the scheduler thread
 *       and from attribute readers concurrently</li>
 *   <li>Non-suspending: each call returns once the backend answered</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface ResourceHandler {

    /**
     * Creates the remote entity.
     *
     * @param name the logical resource name (used to derive a physical name)
     * @param properties the resolved properties
     * @return the backend identifier of the new entity
     * @throws TransportException if the call fails
     */
    ResourceId create(ResourceName name, Properties properties);

    /**
     * Applies changed properties in place.
     *
     * @param id the backend identifier
     * @param diff the changed properties (may be empty)
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity does not exist
     */
    void update(ResourceId id, PropertyDiff diff);

    /**
     * Deletes the remote entity.
     *
     * @param id the backend identifier
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity is already gone
     */
    void delete(ResourceId id);

    /**
     * Suspends the remote entity.
     *
     * @param id the backend identifier
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity does not exist
     */
    void suspend(ResourceId id);

    /**
     * Resumes the remote entity.
     *
     * @param id the backend identifier
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity does not exist
     */
    void resume(ResourceId id);

    /**
     * Fetches the current remote status. Read-only, may be called many times.
     *
     * @param id the backend identifier
     * @return the raw status and optional reason
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity does not exist
     */
    PollResult probe(ResourceId id);

    /**
     * Fetches the structured attributes of the remote entity.
     *
     * @param id the backend identifier
     * @return attribute name to value (never null)
     * @throws TransportException if the call fails
     * @throws RemoteNotFoundException if the entity does not exist
     */
    Map<String, Object> show(ResourceId id);

    /**
     * Properties whose change cannot be applied in place.
     *
     * <p>An update whose diff touches any of these names is rejected with
     * {@link com.ryuqq.lifecycle.core.failure.ReplacementRequiredException}
     * before any remote call.</p>
     *
     * @return property names (empty by default)
     */
    default Set<String> replacementProperties() {
        return Set.of();
    }
}
