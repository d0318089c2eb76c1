/**
 * Resource state machine contract.
 *
 * <h2>Flow</h2>
 * <pre>
 * caller (dependency graph executor)
 *   ↓ perform(action, resource) / update(resource, diff)
 * ResourceLifecycle  → precondition checks, (action, IN_PROGRESS)
 *   ↓ Task
 * TaskRunner / TaskScheduler → remote call, polling, (action, COMPLETE | FAILED)
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.lifecycle;
