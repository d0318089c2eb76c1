package com.ryuqq.lifecycle.adapter.inmemory;

import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.spi.ResourceHandler;

import java.util.Map;
import java.util.Set;

/**
 * {@link ResourceHandler} backed by an {@link InMemoryBackend}.
 *
 * <p>Every call is forwarded as is. Properties listed as replacement properties
 * cannot be changed in place; an update touching them is rejected by the lifecycle
 * before it reaches the backend.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBackend backend = new InMemoryBackend();
 * ResourceHandlerRegistry registry = new ResourceHandlerRegistry()
 *     .register(ResourceType.of("OS::Heat::Stack"),
 *               new InMemoryResourceHandler(backend, Set.of("template")));
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryResourceHandler implements ResourceHandler {

    private final InMemoryBackend backend;
    private final Set<String> replacementProperties;

    public InMemoryResourceHandler(InMemoryBackend backend) {
        this(backend, Set.of());
    }

    /**
     * Creates a handler.
     *
     * @param backend the simulated backend
     * @param replacementProperties properties whose change requires replacement
     * @throws IllegalArgumentException if an argument is null
     */
    public InMemoryResourceHandler(InMemoryBackend backend, Set<String> replacementProperties) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (replacementProperties == null) {
            throw new IllegalArgumentException("replacementProperties cannot be null");
        }
        this.backend = backend;
        this.replacementProperties = Set.copyOf(replacementProperties);
    }

    @Override
    public ResourceId create(ResourceName name, Properties properties) {
        return backend.create(name, properties);
    }

    @Override
    public void update(ResourceId id, PropertyDiff diff) {
        backend.update(id, diff);
    }

    @Override
    public void delete(ResourceId id) {
        backend.delete(id);
    }

    @Override
    public void suspend(ResourceId id) {
        backend.suspend(id);
    }

    @Override
    public void resume(ResourceId id) {
        backend.resume(id);
    }

    @Override
    public PollResult probe(ResourceId id) {
        return backend.probe(id);
    }

    @Override
    public Map<String, Object> show(ResourceId id) {
        return backend.show(id);
    }

    @Override
    public Set<String> replacementProperties() {
        return replacementProperties;
    }
}
