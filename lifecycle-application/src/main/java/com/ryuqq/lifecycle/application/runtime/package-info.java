/**
 * Scheduling substrate contracts.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.runtime.Runtime} - one cooperative scheduling cycle</li>
 *   <li>{@link com.ryuqq.lifecycle.application.runtime.TaskScheduler} - task registration</li>
 *   <li>{@link com.ryuqq.lifecycle.application.runtime.TaskHandle} - completion and cancellation</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.runtime;
