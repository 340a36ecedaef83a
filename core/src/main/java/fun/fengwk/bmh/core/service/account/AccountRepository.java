package fun.fengwk.bmh.core.service.account;

import fun.fengwk.bmh.core.configuration.StorageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads and writes the plain text credentials file.
 *
 * <p>Each non-comment line is {@code username,password[,apiKey]}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountRepository {

    private static final String HEADER = """
        # Account credentials, one per line.
        # Format: username,password[,api_key]
        """;

    private final StorageProperties storageProperties;

    public synchronized List<Account> load() {
        Path file = storageProperties.resolveCredentialsFile();
        if (!Files.exists(file)) {
            log.info("credentials file not found, file={}", file);
            return List.of();
        }
        try {
            return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (Exception ex) {
            throw new IllegalStateException("failed to read credentials file: " + ex.getMessage(), ex);
        }
    }

    public synchronized void save(List<Account> accounts) {
        Path file = storageProperties.resolveCredentialsFile();
        StringBuilder content = new StringBuilder(HEADER);
        for (Account account : accounts) {
            content.append(account.getUsername()).append(',').append(account.getPassword());
            if (account.hasApiKey()) {
                content.append(',').append(account.getApiKey());
            }
            content.append('\n');
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
        } catch (Exception ex) {
            throw new IllegalStateException("failed to write credentials file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Replace the account with the same username or append it.
     */
    public synchronized List<Account> upsert(Account account) {
        List<Account> accounts = new ArrayList<>(load());
        accounts.removeIf(existing -> existing.getUsername().equals(account.getUsername()));
        accounts.add(account);
        accounts.sort(Comparator.comparing(Account::getUsername));
        save(accounts);
        return accounts;
    }

    public synchronized boolean remove(String username) {
        List<Account> accounts = new ArrayList<>(load());
        boolean removed = accounts.removeIf(existing -> existing.getUsername().equals(username));
        if (removed) {
            save(accounts);
        }
        return removed;
    }

    public static List<Account> parse(List<String> lines) {
        List<Account> accounts = new ArrayList<>();
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(",", 3);
            String username = parts[0].trim();
            String password = parts.length > 1 ? parts[1].trim() : "";
            String apiKey = parts.length > 2 ? parts[2].trim() : "";
            if (username.isEmpty() || password.isEmpty()) {
                log.warn("skip invalid credentials line, line={}", lineNumber);
                continue;
            }
            accounts.add(Account.builder()
                .username(username)
                .password(password)
                .apiKey(apiKey.isEmpty() ? null : apiKey)
                .build());
        }
        accounts.sort(Comparator.comparing(Account::getUsername));
        return accounts;
    }

}
