package com.ryuqq.lifecycle.adapter.inmemory;

import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.poll.PollPhase;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.spi.RemoteNotFoundException;
import com.ryuqq.lifecycle.core.spi.TransportException;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory simulation of a remote orchestration service.
 *
 * <p>Each mutating call puts the entity into {@code <ACTION>_IN_PROGRESS}; the entity
 * reaches {@code <ACTION>_COMPLETE} on the {@code probesToComplete}-th probe after the call.
 * A completed DELETE removes the entity, so later calls see it as not found.</p>
 *
 * <p><strong>Fault injection:</strong></p>
 * <ul>
 *   <li>{@link #failNext(ResourceId, String)}: the running (or next) action ends in
 *       {@code <ACTION>_FAILED} with the given reason</li>
 *   <li>{@link #setUnavailable(boolean)}: every call throws {@link TransportException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBackend backend = new InMemoryBackend(2);
 * ResourceId id = backend.create(ResourceName.of("remote_stack"), properties);
 * backend.probe(id);   // CREATE_IN_PROGRESS
 * backend.probe(id);   // CREATE_COMPLETE
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackend.class);

    /**
     * Entities by backend identifier.
     */
    private final ConcurrentHashMap<ResourceId, Entity> entities = new ConcurrentHashMap<>();

    private final int probesToComplete;
    private volatile boolean unavailable;

    /**
     * Creates a backend whose actions complete on the first probe.
     */
    public InMemoryBackend() {
        this(1);
    }

    /**
     * Creates a backend.
     *
     * @param probesToComplete number of probes until an action completes (positive)
     * @throws IllegalArgumentException if probesToComplete is not positive
     */
    public InMemoryBackend(int probesToComplete) {
        if (probesToComplete <= 0) {
            throw new IllegalArgumentException("probesToComplete must be positive (current: " + probesToComplete + ")");
        }
        this.probesToComplete = probesToComplete;
    }

    public ResourceId create(ResourceName name, Properties properties) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        checkAvailable();
        ResourceId id = ResourceId.of(UUID.randomUUID().toString());
        Entity entity = new Entity(name, properties.asMap());
        entity.begin(ResourceAction.CREATE, probesToComplete);
        entities.put(id, entity);
        log.debug("Created {} as {}", name, id);
        return id;
    }

    public void update(ResourceId id, PropertyDiff diff) {
        if (diff == null) {
            throw new IllegalArgumentException("diff cannot be null");
        }
        Entity entity = require(id);
        synchronized (entity) {
            entity.attributes.putAll(diff.asMap());
            entity.begin(ResourceAction.UPDATE, probesToComplete);
        }
    }

    public void delete(ResourceId id) {
        mutate(id, ResourceAction.DELETE);
    }

    public void suspend(ResourceId id) {
        mutate(id, ResourceAction.SUSPEND);
    }

    public void resume(ResourceId id) {
        mutate(id, ResourceAction.RESUME);
    }

    /**
     * Reports the current status, advancing a running action by one probe.
     *
     * @param id backend identifier
     * @return {@code <ACTION>_<PHASE>} status with the failure reason, if any
     * @throws RemoteNotFoundException if the entity does not exist
     * @throws TransportException if the backend is unavailable
     */
    public PollResult probe(ResourceId id) {
        Entity entity = require(id);
        synchronized (entity) {
            if (entity.phase == PollPhase.IN_PROGRESS && --entity.remainingProbes <= 0) {
                if (entity.pendingFailure != null) {
                    entity.phase = PollPhase.FAILED;
                    entity.reason = entity.pendingFailure;
                    entity.pendingFailure = null;
                } else {
                    entity.phase = PollPhase.COMPLETE;
                    if (entity.action == ResourceAction.DELETE) {
                        entities.remove(id);
                        log.debug("Deleted {}", id);
                    }
                }
            }
            return PollResult.of(entity.action, entity.phase, entity.reason);
        }
    }

    /**
     * Returns the attributes of an entity: its properties plus {@code id}, {@code name} and
     * {@code stack_status}.
     *
     * @param id backend identifier
     * @return attribute map
     * @throws RemoteNotFoundException if the entity does not exist
     */
    public Map<String, Object> show(ResourceId id) {
        Entity entity = require(id);
        synchronized (entity) {
            Map<String, Object> attributes = new LinkedHashMap<>(entity.attributes);
            attributes.put("id", id.getValue());
            attributes.put("name", entity.name.getValue());
            attributes.put("stack_status", entity.action.name() + "_" + entity.phase.name());
            return attributes;
        }
    }

    /**
     * Makes the running action, or the next one if none is running, end in failure.
     *
     * @param id backend identifier
     * @param reason reported failure reason
     * @throws RemoteNotFoundException if the entity does not exist
     */
    public void failNext(ResourceId id, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        Entity entity = entities.get(id);
        if (entity == null) {
            throw new RemoteNotFoundException(id);
        }
        synchronized (entity) {
            entity.pendingFailure = reason;
        }
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public boolean contains(ResourceId id) {
        return entities.containsKey(id);
    }

    public int size() {
        return entities.size();
    }

    /**
     * Current status without advancing the entity.
     *
     * @param id backend identifier
     * @return {@code <ACTION>_<PHASE>}, or empty if the entity does not exist
     */
    public Optional<String> statusOf(ResourceId id) {
        Entity entity = entities.get(id);
        if (entity == null) {
            return Optional.empty();
        }
        synchronized (entity) {
            return Optional.of(entity.action.name() + "_" + entity.phase.name());
        }
    }

    private void mutate(ResourceId id, ResourceAction action) {
        Entity entity = require(id);
        synchronized (entity) {
            entity.begin(action, probesToComplete);
        }
    }

    private Entity require(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        checkAvailable();
        Entity entity = entities.get(id);
        if (entity == null) {
            throw new RemoteNotFoundException(id);
        }
        return entity;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new TransportException("Backend unavailable");
        }
    }

    private static final class Entity {

        private final ResourceName name;
        private final Map<String, Object> attributes;
        private ResourceAction action;
        private PollPhase phase;
        private int remainingProbes;
        private String reason;
        private String pendingFailure;

        private Entity(ResourceName name, Map<String, Object> attributes) {
            this.name = name;
            this.attributes = new LinkedHashMap<>(attributes);
        }

        private void begin(ResourceAction action, int probes) {
            this.action = action;
            this.phase = PollPhase.IN_PROGRESS;
            this.remainingProbes = probes;
            this.reason = null;
        }
    }
}
