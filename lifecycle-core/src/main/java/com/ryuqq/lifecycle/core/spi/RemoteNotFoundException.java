package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.ResourceId;

/**
 * Signals that the remote entity does not exist (for example an HTTP 404).
 *
 * <p>During DELETE the task runner treats this as success ("already gone").
 * For every other action it is reported as a NotFound failure.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class RemoteNotFoundException extends RuntimeException {

    private final ResourceId resourceId;

    /**
     * Creates the signal for the given backend identifier.
     *
     * @param resourceId the identifier that was not found
     */
    public RemoteNotFoundException(ResourceId resourceId) {
        super("Remote resource not found: " + (resourceId == null ? "null" : resourceId.getValue()));
        this.resourceId = resourceId;
    }

    public ResourceId resourceId() {
        return resourceId;
    }
}
