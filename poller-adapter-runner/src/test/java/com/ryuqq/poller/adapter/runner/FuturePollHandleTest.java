package com.ryuqq.poller.adapter.runner;

import com.ryuqq.poller.core.attempt.Attempt;
import com.ryuqq.poller.core.failure.FailureKind;
import com.ryuqq.poller.core.failure.PollerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * FuturePollHandle 테스트.
 *
 * <p>Future 예외가 PollerException으로 변환되는지 검증합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FuturePollHandleTest {

    @Mock
    private Future<String> future;

    private Attempt lastAttempt;

    @AfterEach
    void tearDown() {
        Thread.interrupted();
    }

    private FuturePollHandle<String> handle() {
        return new FuturePollHandle<>(future, "p", () -> lastAttempt);
    }

    @Test
    void get_Completed_ReturnsValue() throws Exception {
        when(future.get()).thenReturn("value");

        assertThat(handle().get()).isEqualTo("value");
    }

    @Test
    void get_PollerExceptionCause_PassesThrough() throws Exception {
        PollerException failure = PollerException.userBreak("p", null, "rejected", null);
        when(future.get()).thenThrow(new ExecutionException(failure));

        assertThatThrownBy(() -> handle().get()).isSameAs(failure);
    }

    @Test
    void get_OtherCause_WrapsAsUncaught() throws Exception {
        IOException cause = new IOException("boom");
        when(future.get()).thenThrow(new ExecutionException(cause));

        PollerException exception = catchThrowableOfType(
            () -> handle().get(), PollerException.class);

        assertThat(exception.getKind()).isEqualTo(FailureKind.UNCAUGHT);
        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void get_RuntimeExceptionCause_PassesThroughLikeSyncMode() throws Exception {
        IllegalStateException failure = new IllegalStateException("invalid delay");
        when(future.get()).thenThrow(new ExecutionException(failure));

        assertThatThrownBy(() -> handle().get()).isSameAs(failure);
    }

    @Test
    void get_CancelledAfterAttempts_ReportsLastRecordedAttempt() throws Exception {
        lastAttempt = Attempt.continued(3, Duration.ofSeconds(2), "pending");
        when(future.get()).thenThrow(new CancellationException());

        PollerException exception = catchThrowableOfType(() -> handle().get(), PollerException.class);

        assertThat(exception.getKind()).isEqualTo(FailureKind.INTERRUPTED);
        assertThat(exception.getLastAttempt()).isSameAs(lastAttempt);
        assertThat(exception.getMessage()).contains("after 3 attempt(s)");
    }

    @Test
    void get_CancelledBeforeFirstAttempt_DoesNotClaimZeroAttempts() throws Exception {
        when(future.get()).thenThrow(new CancellationException());

        PollerException exception = catchThrowableOfType(() -> handle().get(), PollerException.class);

        assertThat(exception.getLastAttempt()).isNull();
        assertThat(exception.getMessage()).doesNotContain("after 0 attempt(s)");
    }

    @Test
    void constructor_NullLastAttemptSupplier_ThrowsException() {
        assertThatThrownBy(() -> new FuturePollHandle<>(future, "p", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lastAttempt cannot be null");
    }

    @Test
    void get_Cancelled_MapsToInterrupted() throws Exception {
        when(future.get()).thenThrow(new CancellationException());

        PollerException exception = catchThrowableOfType(
            () -> handle().get(), PollerException.class);

        assertThat(exception.getKind()).isEqualTo(FailureKind.INTERRUPTED);
        assertThat(exception.getPollerName()).isEqualTo("p");
    }

    @Test
    void get_CallerInterrupted_MapsToInterruptedAndRestoresFlag() throws Exception {
        when(future.get()).thenThrow(new InterruptedException());

        PollerException exception = catchThrowableOfType(
            () -> handle().get(), PollerException.class);

        assertThat(exception.getKind()).isEqualTo(FailureKind.INTERRUPTED);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void getWithTimeout_TimesOut_PropagatesTimeoutException() throws Exception {
        when(future.get(100, TimeUnit.MILLISECONDS)).thenThrow(new TimeoutException());

        assertThatThrownBy(() -> handle().get(100, TimeUnit.MILLISECONDS))
            .isInstanceOf(TimeoutException.class);
    }

    @Test
    void getWithTimeout_NullUnit_ThrowsException() {
        assertThatThrownBy(() -> handle().get(1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancel_InterruptsRunningTask() {
        when(future.cancel(true)).thenReturn(true);

        assertThat(handle().cancel()).isTrue();
        verify(future).cancel(true);
    }

    @Test
    void constructor_NullFuture_ThrowsException() {
        assertThatThrownBy(() -> new FuturePollHandle<String>(null, "p", () -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("future cannot be null");
    }
}
