package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.ResourceType;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link ResourceHandler} implementations keyed by {@link ResourceType}.
 *
 * <p>Each resource type contributes one handler. Registering the same type twice
 * is rejected so that a plugin cannot silently shadow another.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ResourceHandlerRegistry registry = new ResourceHandlerRegistry()
 *     .register(ResourceType.of("OS::Neutron::Firewall"), firewallHandler)
 *     .register(ResourceType.of("OS::Heat::Stack"), remoteStackHandler);
 *
 * ResourceHandler handler = registry.resolve(resource.type());
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ResourceHandlerRegistry {

    private final Map<ResourceType, ResourceHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler for a type.
     *
     * @param type the resource type
     * @param handler the handler implementation
     * @return this registry
     * @throws IllegalArgumentException if type or handler is null
     * @throws IllegalStateException if the type is already registered
     */
    public ResourceHandlerRegistry register(ResourceType type, ResourceHandler handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        ResourceHandler previous = handlers.putIfAbsent(type, handler);
        if (previous != null) {
            throw new IllegalStateException("Handler already registered for " + type);
        }
        return this;
    }

    /**
     * Resolves the handler for a type.
     *
     * @param type the resource type
     * @return the registered handler
     * @throws IllegalArgumentException if type is null or has no handler
     */
    public ResourceHandler resolve(ResourceType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        ResourceHandler handler = handlers.get(type);
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for " + type);
        }
        return handler;
    }

    public boolean contains(ResourceType type) {
        return type != null && handlers.containsKey(type);
    }

    /**
     * Registered types.
     *
     * @return an immutable snapshot
     */
    public Set<ResourceType> types() {
        return Set.copyOf(handlers.keySet());
    }
}
