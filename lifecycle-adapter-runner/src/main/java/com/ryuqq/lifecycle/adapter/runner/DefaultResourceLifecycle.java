package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.application.lifecycle.ResourceLifecycle;
import com.ryuqq.lifecycle.core.failure.ReplacementRequiredException;
import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.spi.RemoteNotFoundException;
import com.ryuqq.lifecycle.core.spi.ResourceHandler;
import com.ryuqq.lifecycle.core.spi.ResourceHandlerRegistry;
import com.ryuqq.lifecycle.core.spi.TransportException;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.task.RemoteCall;
import com.ryuqq.lifecycle.core.task.StatusProbe;
import com.ryuqq.lifecycle.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * ResourceLifecycle 기본 구현체.
 *
 * <p>리소스 유형별 {@link ResourceHandler}를 registry에서 찾아 Task를 조립하고,
 * 블로킹 실행은 {@link TaskRunner}에 위임합니다.</p>
 *
 * <p><strong>Task 조립 규칙:</strong></p>
 * <ul>
 *   <li>CREATE: handler.create 결과를 즉시 식별자로 기록 (이후 실패해도 식별자는 유지)</li>
 *   <li>UPDATE: handler.update(id, diff), 완료 시 diff를 리소스 속성에 반영</li>
 *   <li>DELETE/SUSPEND/RESUME: 같은 이름의 handler 메서드 호출</li>
 *   <li>probe: 모든 액션 공통으로 handler.probe(id)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class DefaultResourceLifecycle implements ResourceLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DefaultResourceLifecycle.class);

    /** 전체 속성 Map을 돌려주는 예약 속성 이름. */
    public static final String SHOW_ATTRIBUTE = "show";

    private final ResourceHandlerRegistry registry;
    private final TaskRunnerConfig runnerConfig;

    /**
     * 생성자 (기본 TaskRunnerConfig).
     *
     * @param registry 핸들러 registry
     */
    public DefaultResourceLifecycle(ResourceHandlerRegistry registry) {
        this(registry, new TaskRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param registry 핸들러 registry
     * @param runnerConfig 블로킹 실행 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultResourceLifecycle(ResourceHandlerRegistry registry, TaskRunnerConfig runnerConfig) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (runnerConfig == null) {
            throw new IllegalArgumentException("runnerConfig cannot be null");
        }
        this.registry = registry;
        this.runnerConfig = runnerConfig;
    }

    @Override
    public Task perform(ResourceAction action, ResourceInstance resource) {
        if (action == null || action == ResourceAction.INIT) {
            throw new IllegalArgumentException("action must be a lifecycle action (current: " + action + ")");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (action == ResourceAction.UPDATE) {
            return update(resource, PropertyDiff.empty());
        }
        ResourceHandler handler = registry.resolve(resource.type());
        return prepare(action, resource, handler, PropertyDiff.empty());
    }

    @Override
    public Task update(ResourceInstance resource, PropertyDiff diff) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (diff == null) {
            throw new IllegalArgumentException("diff cannot be null");
        }
        ResourceHandler handler = registry.resolve(resource.type());

        Set<String> offending = new TreeSet<>(diff.changedNames());
        offending.retainAll(handler.replacementProperties());
        if (!offending.isEmpty()) {
            log.info("UPDATE {} requires replacement (properties: {})", resource.name(), offending);
            throw new ReplacementRequiredException(resource.name(), offending);
        }
        return prepare(ResourceAction.UPDATE, resource, handler, diff);
    }

    @Override
    public void run(Task task, long timeoutMs) {
        new TaskRunner(task, runnerConfig).run(timeoutMs);
    }

    @Override
    public Optional<Object> resolveAttribute(ResourceInstance resource, String attributeName) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (attributeName == null || attributeName.isBlank()) {
            throw new IllegalArgumentException("attributeName cannot be null or blank");
        }
        Optional<ResourceId> resourceId = resource.resourceId();
        if (resourceId.isEmpty()) {
            return Optional.empty();
        }

        ResourceHandler handler = registry.resolve(resource.type());
        Map<String, Object> attributes;
        try {
            attributes = handler.show(resourceId.get());
        } catch (RemoteNotFoundException e) {
            throw ResourceFailure.notFound(resource.name(), resource.action());
        } catch (TransportException e) {
            throw ResourceFailure.transport(resource.name(), resource.action(), e);
        }

        if (SHOW_ATTRIBUTE.equals(attributeName)) {
            return Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
        }
        if (!attributes.containsKey(attributeName)) {
            throw ResourceFailure.invalidAttribute(resource.name(), resource.action(), attributeName);
        }
        return Optional.ofNullable(attributes.get(attributeName));
    }

    private Task prepare(ResourceAction action, ResourceInstance resource,
                         ResourceHandler handler, PropertyDiff diff) {
        if (action == ResourceAction.CREATE && resource.hasResourceId()) {
            throw new IllegalStateException("Cannot create " + resource.name() + ", it already has "
                + resource.resourceId().orElseThrow());
        }
        if (action.requiresIdentity() && !resource.hasResourceId()) {
            resource.beginAction(action);
            ResourceFailure failure = ResourceFailure.notFound(resource.name(), action);
            resource.markFailed(failure.toString());
            log.warn("{} {} rejected: {}", action, resource.name(), failure.getMessage());
            throw failure;
        }

        resource.beginAction(action);
        log.debug("{} {} accepted (type: {})", action, resource.name(), resource.type());

        StatusProbe probe = () -> handler.probe(requireId(resource));
        return switch (action) {
            case CREATE -> new Task(resource, action,
                () -> resource.assignResourceId(handler.create(resource.name(), resource.properties())), probe);
            case UPDATE -> new Task(resource, action,
                () -> handler.update(requireId(resource), diff), probe,
                () -> resource.replaceProperties(merge(resource.properties(), diff)));
            case DELETE -> new Task(resource, action, call(handler::delete, resource), probe);
            case SUSPEND -> new Task(resource, action, call(handler::suspend, resource), probe);
            case RESUME -> new Task(resource, action, call(handler::resume, resource), probe);
            default -> throw new IllegalArgumentException("Unsupported action: " + action);
        };
    }

    private static RemoteCall call(Consumer<ResourceId> operation, ResourceInstance resource) {
        return () -> operation.accept(requireId(resource));
    }

    private static ResourceId requireId(ResourceInstance resource) {
        return resource.resourceId().orElseThrow(
            () -> new IllegalStateException(resource.name() + " has no resource id"));
    }

    private static Properties merge(Properties current, PropertyDiff diff) {
        Map<String, Object> merged = new LinkedHashMap<>(current.asMap());
        merged.putAll(diff.asMap());
        return Properties.of(merged);
    }
}
