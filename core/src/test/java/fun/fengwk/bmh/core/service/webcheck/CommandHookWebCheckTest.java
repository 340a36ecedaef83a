package fun.fengwk.bmh.core.service.webcheck;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CommandHookWebCheck tests.
 *
 * @author fengwk
 */
class CommandHookWebCheckTest {

    private static final WebCheckRetry RETRY = WebCheckRetry.of(1, Duration.ZERO);

    private WebCheckProperties properties;
    private CommandHookWebCheck hook;

    @BeforeEach
    void setUp() {
        properties = new WebCheckProperties();
        properties.setEnabled(true);
        properties.setCommand(" /usr/local/bin/login-hook ");
        properties.setArgs(List.of("--user={username}", "--pass={password}", "--key={api_key}"));
        hook = new CommandHookWebCheck(properties, new ObjectMapper());
    }

    @Test
    void shouldSubstitutePlaceholders() {
        Account account = Account.builder().username("alice").password("secret").apiKey("sk-1").build();

        assertThat(hook.buildCommand(account)).containsExactly(
            "/usr/local/bin/login-hook", "--user=alice", "--pass=secret", "--key=sk-1");
    }

    @Test
    void shouldSubstituteBlankKeyWhenMissing() {
        Account account = Account.builder().username("bob").password("pw").build();

        assertThat(hook.buildCommand(account)).endsWith("--key=");
    }

    @Test
    void shouldTreatEmptyOutputAsSuccessWithoutBalance() {
        WebCheckResult result = hook.parseOutput("");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBalance()).isNull();
    }

    @Test
    void shouldHonourJsonOutput() {
        WebCheckResult ok = hook.parseOutput("{\"success\": true, \"balance\": \"$12.5\", \"message\": \"logged in\"}");
        WebCheckResult failed = hook.parseOutput("{\"balance\": 3}");

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.getBalance()).isEqualTo(12.5D);
        assertThat(ok.getMessage()).isEqualTo("logged in");
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getBalance()).isEqualTo(3D);
    }

    @Test
    void shouldTakeFirstNumberFromText() {
        WebCheckResult result = hook.parseOutput("login ok, balance $8.75");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBalance()).isEqualTo(8.75D);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void shouldRunCommandAndParseStdout() throws Exception {
        properties.setCommand("sh");
        properties.setArgs(List.of("-c", "echo '{\"success\": true, \"balance\": 21.5}'"));
        Account account = Account.builder().username("alice").password("secret").build();

        WebCheckResult result = hook.check(account, RETRY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBalance()).isEqualTo(21.5D);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void shouldFailOnNonZeroExit() {
        properties.setCommand("sh");
        properties.setArgs(List.of("-c", "echo 'bad password' >&2; exit 3"));
        Account account = Account.builder().username("alice").password("secret").build();

        assertThatThrownBy(() -> hook.check(account, RETRY))
            .isInstanceOf(WebCheckException.class)
            .hasMessageContaining("exited with code 3")
            .hasMessageContaining("bad password");
    }

    @Test
    void shouldFailWhenCommandCannotStart() {
        properties.setCommand("/nonexistent/bmh-login-hook");
        Account account = Account.builder().username("alice").password("secret").build();

        assertThatThrownBy(() -> hook.check(account, RETRY))
            .isInstanceOf(WebCheckException.class)
            .hasMessageContaining("failed to start web check command");
    }

}
