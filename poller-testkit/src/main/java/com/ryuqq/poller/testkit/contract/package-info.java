/**
 * Contract tests every {@link com.ryuqq.poller.application.poller.Poller} implementation must pass.
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.testkit.contract;
