/**
 * 리소스 엔티티.
 *
 * <p>{@link com.ryuqq.lifecycle.core.resource.ResourceInstance}는 식별자와 (action, status) 상태를
 * 보관하는 유일한 가변 객체이며, 현재 Task를 실행 중인 TaskRunner만 상태를 변경합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.resource;
