package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import fun.fengwk.bmh.core.service.browser.runtime.PoolTicket;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerLeaseTimeoutException;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerProcessPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PooledBrowserWebCheck tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class PooledBrowserWebCheckTest {

    private static final String ENDPOINT = "http://127.0.0.1:9222";

    @Mock
    private WorkerProcessPool pool;

    @Mock
    private WebLoginFlow flow;

    private final Account account = Account.builder().username("alice").password("secret").build();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private WebCheckProperties properties;
    private PooledBrowserWebCheck webCheck;

    @BeforeEach
    void setUp() {
        properties = new WebCheckProperties();
        properties.setTimeoutSeconds(10);
        properties.setLeaseTimeoutMs(500);
        properties.setLeasePollIntervalMs(20);
        webCheck = new PooledBrowserWebCheck(pool, flow, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunFlowOnLeasedWorkerAndRelease() throws Exception {
        PoolTicket ticket = leaseTicket();
        when(flow.runOnce(account, ENDPOINT)).thenReturn(WebCheckResult.ok(10D, "balance read"));

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(2, Duration.ZERO));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBalance()).isEqualTo(10D);
        verify(pool).acquire(500L, 20L);
        verify(pool, timeout(1000)).release(ticket);
    }

    @Test
    void shouldCarryApiKeySyncOutcome() throws Exception {
        PoolTicket ticket = leaseTicket();
        when(flow.runOnce(account, ENDPOINT)).thenReturn(
            WebCheckResult.synced(10D, ApiKeySyncResult.fail("quota sync failed: submit button not found")));

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(1, Duration.ZERO));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBalance()).isEqualTo(10D);
        assertThat(result.getApikeySyncSuccess()).isFalse();
        assertThat(result.getApikeySyncMessage()).isEqualTo("quota sync failed: submit button not found");
        assertThat(result.getMessage()).isEqualTo("quota sync failed: submit button not found");
        verify(pool, timeout(1000)).release(ticket);
    }

    @Test
    void shouldRetryFailedAttempts() throws Exception {
        leaseTicket();
        when(flow.runOnce(account, ENDPOINT))
            .thenThrow(new IllegalStateException("login form not found"))
            .thenThrow(new IllegalStateException("navigation failed"))
            .thenReturn(WebCheckResult.ok(3D, "balance read"));

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(3, Duration.ofMillis(10)));

        assertThat(result.isSuccess()).isTrue();
        verify(flow, times(3)).runOnce(account, ENDPOINT);
    }

    @Test
    void shouldReportLastErrorAfterExhaustedRetries() throws Exception {
        PoolTicket ticket = leaseTicket();
        when(flow.runOnce(account, ENDPOINT))
            .thenThrow(new IllegalStateException("first"))
            .thenThrow(new IllegalStateException("second"));

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(2, Duration.ZERO));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("web login failed after 2 attempts: second");
        verify(pool, timeout(1000)).release(ticket);
    }

    @Test
    void shouldNotRetryReturnedFailure() throws Exception {
        leaseTicket();
        when(flow.runOnce(account, ENDPOINT)).thenReturn(WebCheckResult.fail("login failed: wrong password"));

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(3, Duration.ZERO));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("login failed: wrong password");
        verify(flow, times(1)).runOnce(account, ENDPOINT);
    }

    @Test
    void shouldThrowWhenLeaseTimesOut() throws Exception {
        when(pool.acquire(anyLong(), anyLong()))
            .thenThrow(new WorkerLeaseTimeoutException("timed out waiting for an available browser worker (500ms)"));

        assertThatThrownBy(() -> webCheck.check(account, WebCheckRetry.of(1, Duration.ZERO)))
            .isInstanceOf(WebCheckException.class)
            .hasMessageContaining("timed out");
        verify(flow, never()).runOnce(any(), any());
        verify(pool, never()).release(any());
    }

    @Test
    void shouldThrowWhenPoolUnavailable() throws Exception {
        when(pool.acquire(anyLong(), anyLong())).thenThrow(new IllegalStateException("worker process pool is shutdown"));

        assertThatThrownBy(() -> webCheck.check(account, WebCheckRetry.of(1, Duration.ZERO)))
            .isInstanceOf(WebCheckException.class)
            .hasMessage("browser worker unavailable: worker process pool is shutdown");
    }

    @Test
    void shouldAbandonStuckFlowAndReleaseWorker() throws Exception {
        properties.setTimeoutSeconds(1);
        PoolTicket ticket = leaseTicket();
        when(flow.runOnce(account, ENDPOINT)).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return WebCheckResult.ok(1D, "too late");
        });

        WebCheckResult result = webCheck.check(account, WebCheckRetry.of(1, Duration.ZERO));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("web flow timed out (1s)");
        verify(pool, timeout(3000)).release(eq(ticket));
    }

    private PoolTicket leaseTicket() throws InterruptedException {
        PoolTicket ticket = mock(PoolTicket.class);
        when(ticket.getEndpoint()).thenReturn(ENDPOINT);
        when(pool.acquire(anyLong(), anyLong())).thenReturn(ticket);
        return ticket;
    }

}
