/**
 * 리소스 식별 및 속성 Value Object.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.ResourceName} - 템플릿 상의 논리 이름</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.ResourceType} - 핸들러 레지스트리 키</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.ResourceId} - 백엔드 식별자</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.Properties} - CREATE 입력 속성</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.PropertyDiff} - UPDATE 변경분</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.model;
