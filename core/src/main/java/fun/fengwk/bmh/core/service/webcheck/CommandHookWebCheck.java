package fun.fengwk.bmh.core.service.webcheck;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import fun.fengwk.bmh.core.utils.BalanceNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Web check delegated to an external hook command.
 *
 * <p>The command may print nothing, a JSON object {@code {"success":..,"balance":..,"message":..}},
 * or plain text whose first number is taken as the balance.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandHookWebCheck implements WebCheckStrategy {

    private static final int MIN_TIMEOUT_SECONDS = 5;

    private final WebCheckProperties webCheckProperties;
    private final ObjectMapper objectMapper;

    @Override
    public WebCheckResult check(Account account, WebCheckRetry retry) throws WebCheckException {
        List<String> command = buildCommand(account);
        int timeoutSeconds = Math.max(MIN_TIMEOUT_SECONDS, webCheckProperties.getTimeoutSeconds());

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new WebCheckException("failed to start web check command: " + ex.getMessage(), ex);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new WebCheckException("web check command timed out (" + timeoutSeconds + "s)");
            }
            String out = stdout.get(timeoutSeconds, TimeUnit.SECONDS).trim();
            String err = stderr.get(timeoutSeconds, TimeUnit.SECONDS).trim();
            if (process.exitValue() != 0) {
                throw new WebCheckException("web check command exited with code " + process.exitValue()
                    + ": " + (err.isEmpty() ? out : err));
            }
            log.debug("web check command finished, username={}, stdout={}", account.getUsername(), out);
            return parseOutput(out);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new WebCheckException("interrupted while running web check command", ex);
        } catch (WebCheckException ex) {
            throw ex;
        } catch (Exception ex) {
            process.destroyForcibly();
            throw new WebCheckException("failed to read web check command output: " + ex.getMessage(), ex);
        }
    }

    List<String> buildCommand(Account account) {
        List<String> command = new ArrayList<>();
        command.add(webCheckProperties.getCommand().trim());
        if (webCheckProperties.getArgs() != null) {
            for (String arg : webCheckProperties.getArgs()) {
                command.add(arg
                    .replace("{username}", account.getUsername())
                    .replace("{password}", account.getPassword())
                    .replace("{api_key}", account.hasApiKey() ? account.getApiKey() : ""));
            }
        }
        return command;
    }

    WebCheckResult parseOutput(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return WebCheckResult.ok(null, "web check command succeeded without a balance");
        }
        try {
            JsonNode node = objectMapper.readTree(stdout);
            if (node != null && node.isObject()) {
                String message = node.path("message").asText("");
                return WebCheckResult.builder()
                    .success(node.path("success").asBoolean(false))
                    .balance(toBalance(node.get("balance")))
                    .message(message.isBlank() ? "web check command finished" : message)
                    .build();
            }
        } catch (JsonProcessingException ex) {
            log.debug("web check command output is not json, output={}", stdout);
        }
        return WebCheckResult.ok(BalanceNumbers.parseFirstNumber(stdout), "web check command returned text");
    }

    private Double toBalance(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        return BalanceNumbers.parseFirstNumber(node.asText());
    }

    private static String readFully(InputStream input) {
        try (input) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read process output: " + ex.getMessage(), ex);
        }
    }

}
