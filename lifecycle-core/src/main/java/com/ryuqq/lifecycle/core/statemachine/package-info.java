/**
 * Resource state machine package.
 *
 * <p>This package defines the (action, status) pair of a resource and the rules
 * for moving between pairs.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.ResourceAction} - lifecycle actions (enum)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.ResourceStatus} - progress of the current action (enum)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.ResourceState} - the observable (action, status) pair</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ResourceState state = ResourceState.INITIAL;                          // INIT_COMPLETE
 * state = StateTransition.begin(state, ResourceAction.CREATE);          // CREATE_IN_PROGRESS
 * state = StateTransition.finish(state, ResourceStatus.COMPLETE);       // CREATE_COMPLETE
 *
 * // This will throw IllegalStateException
 * StateTransition.finish(state, ResourceStatus.FAILED);
 * </pre>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.statemachine;
