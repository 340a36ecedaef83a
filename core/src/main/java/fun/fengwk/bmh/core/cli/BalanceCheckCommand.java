package fun.fengwk.bmh.core.cli;

import fun.fengwk.bmh.core.configuration.PerformanceProperties;
import fun.fengwk.bmh.core.facade.query.BalanceQueryFacade;
import fun.fengwk.bmh.core.facade.query.model.QueryResponse;
import fun.fengwk.bmh.core.report.ReportFormatter;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.account.AccountRepository;
import fun.fengwk.bmh.core.service.monitor.CheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Command line runner.
 *
 * <ul>
 *     <li>{@code --check} run one batch, {@code --web-only} run one web login batch</li>
 *     <li>{@code --account=<name>} restrict the batch to one account</li>
 *     <li>{@code --watch} repeat normal batches every {@code bmh.performance.query-interval-minutes}</li>
 *     <li>{@code --cached} print cached balances, the default without options</li>
 *     <li>{@code --report} print the performance report</li>
 *     <li>{@code --upsert-account=user,pass[,key]} and {@code --remove-account=<name>} edit credentials</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BalanceCheckCommand implements ApplicationRunner {

    static final String RESULT_TEMPLATE = "bmh_check_result.ftl";

    private final BalanceQueryFacade balanceQueryFacade;
    private final ReportFormatter reportFormatter;
    private final PerformanceProperties performanceProperties;

    private final PrintStream out = System.out;

    @Override
    public void run(ApplicationArguments args) {
        String target = firstValue(args, "account");
        boolean handled = false;

        String upsert = firstValue(args, "upsert-account");
        if (upsert != null) {
            upsertAccount(upsert);
            handled = true;
        }
        String remove = firstValue(args, "remove-account");
        if (remove != null) {
            boolean removed = balanceQueryFacade.removeAccount(remove.trim());
            out.println(removed ? "removed account " + remove.trim() : "account not found: " + remove.trim());
            handled = true;
        }

        if (args.containsOption("watch")) {
            watch(target);
            return;
        }
        if (args.containsOption("check")) {
            printResponse("normal", balanceQueryFacade.query(target));
            handled = true;
        }
        if (args.containsOption("web-only")) {
            printResponse("web_only", balanceQueryFacade.webLoginOnly(target));
            handled = true;
        }
        if (args.containsOption("report")) {
            out.println(balanceQueryFacade.performanceReport());
            handled = true;
        }
        if (args.containsOption("cached") || !handled) {
            printCached();
        }
    }

    private void upsertAccount(String line) {
        List<Account> parsed = AccountRepository.parse(List.of(line));
        if (parsed.isEmpty()) {
            out.println("invalid account, expected username,password[,api_key]");
            return;
        }
        Account account = parsed.get(0);
        balanceQueryFacade.upsertAccount(account);
        out.println("saved account " + account.getUsername());
    }

    private void watch(String target) {
        long intervalMinutes = Math.max(1, performanceProperties.getQueryIntervalMinutes());
        log.info("watch mode started, intervalMinutes={}, target={}", intervalMinutes, target);
        while (!Thread.currentThread().isInterrupted()) {
            try {
                printResponse("normal", balanceQueryFacade.query(target));
            } catch (RuntimeException ex) {
                log.error("watch batch failed, error={}", ex.getMessage(), ex);
            }
            try {
                TimeUnit.MINUTES.sleep(intervalMinutes);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.info("watch mode interrupted");
            }
        }
    }

    private void printResponse(String mode, QueryResponse response) {
        Map<String, Object> model = new HashMap<>();
        model.put("mode", mode);
        model.put("results", response.getResults());
        model.put("response", response);
        out.println(reportFormatter.format(RESULT_TEMPLATE, model));
    }

    private void printCached() {
        List<CheckResult> results = balanceQueryFacade.cachedResults();
        Map<String, Object> model = new HashMap<>();
        model.put("mode", "cached");
        model.put("results", results);
        out.println(reportFormatter.format(RESULT_TEMPLATE, model));
    }

    private String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value;
    }

}
