/**
 * 원격 상태 probe 결과와 분류 규칙.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.poll;
