package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.model.Properties;
import com.ryuqq.lifecycle.core.model.PropertyDiff;
import com.ryuqq.lifecycle.core.model.ResourceId;
import com.ryuqq.lifecycle.core.model.ResourceName;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.spi.RemoteNotFoundException;
import com.ryuqq.lifecycle.core.spi.ResourceHandler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scripted {@link ResourceHandler} for contract tests.
 *
 * <p>Probe answers are consumed in order from a script; once the script is exhausted the
 * last scripted answer repeats. Every call is recorded by name so tests can assert exactly
 * which remote calls were made.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * handler.willCreate("stack-1")
 *        .thenProbe("CREATE_IN_PROGRESS")
 *        .thenProbe("CREATE_COMPLETE");
 * ...
 * assertThat(handler.calls()).containsExactly("create", "probe", "probe");
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class ScriptedResourceHandler implements ResourceHandler {

    public static final String CREATE = "create";
    public static final String UPDATE = "update";
    public static final String DELETE = "delete";
    public static final String SUSPEND = "suspend";
    public static final String RESUME = "resume";
    public static final String PROBE = "probe";
    public static final String SHOW = "show";

    private static final Set<String> MUTATING_CALLS = Set.of(CREATE, UPDATE, DELETE, SUSPEND, RESUME);

    private final Deque<Object> probeScript = new ArrayDeque<>();
    private final List<String> calls = new ArrayList<>();
    private final Map<String, RuntimeException> callFailures = new HashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Object lastProbeAnswer;
    private ResourceId createdId = ResourceId.of("remote-stack-id");
    private ResourceId lastUpdatedId;
    private PropertyDiff lastDiff;
    private Set<String> replacementProperties = Set.of();

    public synchronized ScriptedResourceHandler willCreate(String id) {
        this.createdId = ResourceId.of(id);
        return this;
    }

    public synchronized ScriptedResourceHandler thenProbe(String status) {
        return thenProbe(status, null);
    }

    public synchronized ScriptedResourceHandler thenProbe(String status, String reason) {
        probeScript.addLast(PollResult.of(status, reason));
        return this;
    }

    /**
     * Scripts a probe that throws instead of answering.
     *
     * @param failure the exception to throw (for example a TransportException)
     * @return this handler
     */
    public synchronized ScriptedResourceHandler thenProbeThrow(RuntimeException failure) {
        probeScript.addLast(failure);
        return this;
    }

    /**
     * Makes every call with the given name throw.
     *
     * @param call call name, one of the constants of this class
     * @param failure the exception to throw
     * @return this handler
     */
    public synchronized ScriptedResourceHandler failOn(String call, RuntimeException failure) {
        callFailures.put(call, failure);
        return this;
    }

    /**
     * Makes the delete call and every probe report the entity as gone.
     *
     * @return this handler
     */
    public synchronized ScriptedResourceHandler alreadyGone() {
        callFailures.put(DELETE, new RemoteNotFoundException(createdId));
        callFailures.put(PROBE, new RemoteNotFoundException(createdId));
        return this;
    }

    public synchronized ScriptedResourceHandler withAttribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    public synchronized ScriptedResourceHandler withReplacementProperties(Set<String> names) {
        this.replacementProperties = Set.copyOf(names);
        return this;
    }

    /**
     * Forgets recorded calls, the probe script and injected failures.
     */
    public synchronized void reset() {
        probeScript.clear();
        calls.clear();
        callFailures.clear();
        lastProbeAnswer = null;
        lastUpdatedId = null;
        lastDiff = null;
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public synchronized long mutatingCallCount() {
        return calls.stream().filter(MUTATING_CALLS::contains).count();
    }

    public synchronized long probeCount() {
        return calls.stream().filter(PROBE::equals).count();
    }

    public synchronized ResourceId lastUpdatedId() {
        return lastUpdatedId;
    }

    public synchronized PropertyDiff lastDiff() {
        return lastDiff;
    }

    @Override
    public synchronized ResourceId create(ResourceName name, Properties properties) {
        record(CREATE);
        return createdId;
    }

    @Override
    public synchronized void update(ResourceId id, PropertyDiff diff) {
        record(UPDATE);
        this.lastUpdatedId = id;
        this.lastDiff = diff;
    }

    @Override
    public synchronized void delete(ResourceId id) {
        record(DELETE);
    }

    @Override
    public synchronized void suspend(ResourceId id) {
        record(SUSPEND);
    }

    @Override
    public synchronized void resume(ResourceId id) {
        record(RESUME);
    }

    @Override
    public synchronized PollResult probe(ResourceId id) {
        record(PROBE);
        Object answer = probeScript.isEmpty() ? lastProbeAnswer : probeScript.pollFirst();
        if (answer == null) {
            throw new IllegalStateException("No probe answer scripted for " + id);
        }
        lastProbeAnswer = answer;
        if (answer instanceof RuntimeException failure) {
            throw failure;
        }
        return (PollResult) answer;
    }

    @Override
    public synchronized Map<String, Object> show(ResourceId id) {
        record(SHOW);
        return new LinkedHashMap<>(attributes);
    }

    @Override
    public synchronized Set<String> replacementProperties() {
        return replacementProperties;
    }

    private void record(String call) {
        calls.add(call);
        RuntimeException failure = callFailures.get(call);
        if (failure != null) {
            throw failure;
        }
    }
}
