/**
 * 구조화된 실패 타입.
 *
 * <p>{@link com.ryuqq.lifecycle.core.failure.ResourceFailure}는 실패 종류
 * ({@link com.ryuqq.lifecycle.core.failure.FailureKind}), 리소스 이름, 액션을 담으며
 * 메시지는 종류별 고정 패턴을 따릅니다.</p>
 *
 * <pre>
 * NotFound              : Cannot &lt;action&gt; &lt;name&gt;, resource not found
 * ResourceInError       : Went to status &lt;STATUS&gt; due to "&lt;reason&gt;"
 * ResourceUnknownStatus : Resource failed - Unknown status &lt;STATUS&gt;
 * InvalidAttribute      : The Referenced Attribute (&lt;resource&gt; &lt;name&gt;) is incorrect.
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.failure;
