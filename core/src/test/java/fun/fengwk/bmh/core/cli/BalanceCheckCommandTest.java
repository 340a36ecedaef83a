package fun.fengwk.bmh.core.cli;

import fun.fengwk.bmh.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.bmh.core.configuration.PerformanceProperties;
import fun.fengwk.bmh.core.facade.query.BalanceQueryFacade;
import fun.fengwk.bmh.core.facade.query.model.QueryResponse;
import fun.fengwk.bmh.core.report.ReportFormatter;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.monitor.CheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BalanceCheckCommand tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class BalanceCheckCommandTest {

    @Mock
    private BalanceQueryFacade balanceQueryFacade;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private BalanceCheckCommand command;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        command = new BalanceCheckCommand(
            balanceQueryFacade,
            new ReportFormatter(new FreeMarkerConfiguration().reportTemplateConfiguration()),
            new PerformanceProperties()
        );
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void shouldPrintCachedViewWithoutOptions() {
        when(balanceQueryFacade.cachedResults())
            .thenReturn(List.of(CheckResult.success("alice", "$3.5", "cache", "cached at 2026-03-10T09:00:00")));

        command.run(new DefaultApplicationArguments());

        assertThat(output()).contains("== cached ==").contains("alice $3.5 (cache)");
    }

    @Test
    void shouldRunCheckForTargetAccount() {
        List<CheckResult> results = List.of(CheckResult.success("bob", "$10.0", "web_hook", null));
        when(balanceQueryFacade.query("bob")).thenReturn(QueryResponse.builder()
            .results(results)
            .elapsedSecs(2D)
            .finishedAt("2026-03-10 12:00:00")
            .successCount(1)
            .totalBalance(10D)
            .totalBalanceCount(1)
            .build());

        command.run(new DefaultApplicationArguments("--check", "--account=bob"));

        assertThat(output())
            .contains("== normal ==")
            .contains("bob $10.0 (web_hook)")
            .contains("total balance: $10.0 across 1 accounts");
        verify(balanceQueryFacade, never()).cachedResults();
    }

    @Test
    void shouldUpsertParsedAccount() {
        command.run(new DefaultApplicationArguments("--upsert-account=alice,pw,sk-1"));

        verify(balanceQueryFacade).upsertAccount(Account.builder().username("alice").password("pw").apiKey("sk-1").build());
        assertThat(output()).contains("saved account alice");
    }

    @Test
    void shouldRejectInvalidAccountLine() {
        command.run(new DefaultApplicationArguments("--upsert-account=alice"));

        verify(balanceQueryFacade, never()).upsertAccount(any());
        assertThat(output()).contains("invalid account");
    }

    @Test
    void shouldReportRemoval() {
        when(balanceQueryFacade.removeAccount("ghost")).thenReturn(false);

        command.run(new DefaultApplicationArguments("--remove-account=ghost"));

        assertThat(output()).contains("account not found: ghost");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

}
