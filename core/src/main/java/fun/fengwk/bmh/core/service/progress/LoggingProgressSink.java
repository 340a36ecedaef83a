package fun.fengwk.bmh.core.service.progress;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes progress events to the application log.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void emit(ProgressLevel level, String username, String message) {
        String account = username == null || username.isEmpty() ? "-" : username;
        switch (level) {
            case WARN -> log.warn("[{}] {}", account, message);
            case ERROR -> log.error("[{}] {}", account, message);
            default -> log.info("[{}] {}", account, message);
        }
    }

}
