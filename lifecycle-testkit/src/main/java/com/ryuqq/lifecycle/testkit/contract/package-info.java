/**
 * Contract test support: a scripted resource handler and the base class shared by
 * the lifecycle contract tests.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.contract;
