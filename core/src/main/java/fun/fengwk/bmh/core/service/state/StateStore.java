package fun.fengwk.bmh.core.service.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Durable per-account state: last known balance and the cycle day of the last successful web login.
 *
 * <p>Both documents share the layout {@code {"version":1,"updated_at":...,"accounts":{...}}} and are
 * replaced atomically on every update. A single lock guards each read-modify-persist sequence.
 *
 * @author fengwk
 */
@Slf4j
public class StateStore {

    private static final int DOCUMENT_VERSION = 1;
    private static final String ACCOUNTS_FIELD = "accounts";
    private static final String VERSION_FIELD = "version";
    private static final String UPDATED_AT_FIELD = "updated_at";
    private static final Pattern CYCLE_DAY_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final DateTimeFormatter LEGACY_TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final Path balanceFile;
    private final Path cycleFile;
    private final int rolloverHour;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BalanceRecord> balances = new TreeMap<>();
    private final Map<String, String> cycleMarkers = new TreeMap<>();

    private StateStore(Path balanceFile, Path cycleFile, int rolloverHour, ObjectMapper objectMapper, Clock clock) {
        this.balanceFile = balanceFile;
        this.cycleFile = cycleFile;
        this.rolloverHour = CycleDayPolicy.normalizeRolloverHour(rolloverHour);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Load both state files, missing files start empty.
     *
     * @throws StatePersistenceException if a file exists but cannot be parsed
     */
    public static StateStore load(Path balanceFile, Path cycleFile, int rolloverHour, ObjectMapper objectMapper, Clock clock) {
        StateStore store = new StateStore(balanceFile, cycleFile, rolloverHour, objectMapper, clock);
        store.loadBalances();
        store.loadCycleMarkers();
        return store;
    }

    public int getRolloverHour() {
        return rolloverHour;
    }

    public String currentCycleDay() {
        return CycleDayPolicy.currentCycleDay(LocalDateTime.now(clock), rolloverHour).toString();
    }

    /**
     * Whether the account has not yet completed a successful web login in the current cycle day.
     */
    public boolean shouldForceFull(String username) {
        String cycleDay = currentCycleDay();
        lock.lock();
        try {
            return !cycleDay.equals(cycleMarkers.get(username));
        } finally {
            lock.unlock();
        }
    }

    public void markCycleFulfilled(String username) {
        String cycleDay = currentCycleDay();
        lock.lock();
        try {
            cycleMarkers.put(username, cycleDay);
            persistCycleMarkers();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Upsert the balance of an account.
     *
     * @param syncMessage replaces the previous sync message only when not {@code null}
     */
    public void updateBalance(String username, String balanceText, Boolean syncSuccess, String syncMessage) {
        lock.lock();
        try {
            BalanceRecord record = balances.computeIfAbsent(username, key -> new BalanceRecord());
            record.setBalance(balanceText);
            record.setUpdatedAt(nowText());
            record.setApikeySyncSuccess(syncSuccess);
            if (syncMessage != null) {
                record.setApikeySyncMessage(syncMessage);
            }
            persistBalances();
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getCachedBalance(String username) {
        return getCachedRecord(username)
            .map(BalanceRecord::getBalance)
            .filter(balance -> !balance.isBlank());
    }

    public Optional<BalanceRecord> getCachedRecord(String username) {
        lock.lock();
        try {
            BalanceRecord record = balances.get(username);
            return record == null ? Optional.empty() : Optional.of(record.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getCycleMarker(String username) {
        lock.lock();
        try {
            return Optional.ofNullable(cycleMarkers.get(username));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> cachedUsernames() {
        lock.lock();
        try {
            return new TreeSet<>(balances.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void loadBalances() {
        JsonNode root = readDocument(balanceFile);
        JsonNode accounts = resolveAccounts(root);
        if (accounts == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = accounts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isDocumentField(root, accounts, field.getKey())) {
                continue;
            }
            BalanceRecord record = toBalanceRecord(field.getValue());
            if (record == null || record.getBalance() == null || record.getBalance().isBlank()) {
                log.debug("drop invalid balance entry, username={}", field.getKey());
                continue;
            }
            balances.put(field.getKey(), record);
        }
    }

    private void loadCycleMarkers() {
        JsonNode root = readDocument(cycleFile);
        JsonNode accounts = resolveAccounts(root);
        if (accounts == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = accounts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isDocumentField(root, accounts, field.getKey())) {
                continue;
            }
            String value = field.getValue().isTextual() ? field.getValue().asText().trim() : "";
            if (!isValidCycleDay(value)) {
                log.debug("drop invalid cycle marker, username={}, value={}", field.getKey(), field.getValue());
                continue;
            }
            cycleMarkers.put(field.getKey(), value);
        }

        int corrected = correctLegacyMarkers(root.path(UPDATED_AT_FIELD).asText(""));
        if (corrected > 0) {
            log.warn("corrected legacy cycle markers, count={}, file={}, rolloverHour={}", corrected, cycleFile, rolloverHour);
            persistCycleMarkers();
        }
    }

    /**
     * Older releases wrote calendar dates instead of cycle days. A document saved before the rollover
     * hour carries markers equal to the calendar date, which belong to the previous cycle day.
     */
    private int correctLegacyMarkers(String updatedAt) {
        LocalDateTime savedAt = parseTimestamp(updatedAt);
        if (savedAt == null || savedAt.getHour() >= rolloverHour) {
            return 0;
        }
        String savedDate = savedAt.toLocalDate().toString();
        String cycleDay = savedAt.toLocalDate().minusDays(1).toString();
        int corrected = 0;
        for (Map.Entry<String, String> entry : cycleMarkers.entrySet()) {
            if (savedDate.equals(entry.getValue())) {
                entry.setValue(cycleDay);
                corrected++;
            }
        }
        return corrected;
    }

    private JsonNode readDocument(Path file) {
        if (!Files.exists(file)) {
            return objectMapper.createObjectNode();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(content);
        } catch (Exception ex) {
            log.error("failed to read state file, file={}, error={}", file, ex.getMessage(), ex);
            throw new StatePersistenceException("failed to read state file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private JsonNode resolveAccounts(JsonNode root) {
        JsonNode accounts = root.get(ACCOUNTS_FIELD);
        if (accounts != null && accounts.isObject()) {
            return accounts;
        }
        // Legacy flat layout: {username -> value}.
        return root.isObject() ? root : null;
    }

    private boolean isDocumentField(JsonNode root, JsonNode accounts, String key) {
        return root == accounts && (VERSION_FIELD.equals(key) || UPDATED_AT_FIELD.equals(key) || ACCOUNTS_FIELD.equals(key));
    }

    private BalanceRecord toBalanceRecord(JsonNode node) {
        if (node.isTextual() || node.isNumber()) {
            return BalanceRecord.builder().balance(node.asText().trim()).build();
        }
        if (!node.isObject()) {
            return null;
        }
        JsonNode balance = node.get("balance");
        if (balance == null || !(balance.isTextual() || balance.isNumber())) {
            return null;
        }
        JsonNode syncSuccess = node.get("apikey_sync_success");
        return BalanceRecord.builder()
            .balance(balance.asText().trim())
            .updatedAt(node.path(UPDATED_AT_FIELD).asText(""))
            .apikeySyncSuccess(syncSuccess != null && syncSuccess.isBoolean() ? syncSuccess.asBoolean() : null)
            .apikeySyncMessage(node.path("apikey_sync_message").asText(""))
            .build();
    }

    private boolean isValidCycleDay(String value) {
        if (!CYCLE_DAY_PATTERN.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    private LocalDateTime parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text.trim()).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            log.debug("updated_at is not RFC3339, fallback to local format, value={}", text);
        }
        try {
            return LocalDateTime.parse(text.trim(), LEGACY_TIMESTAMP_FORMATTER);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private void persistBalances() {
        writeDocument(balanceFile, objectMapper.valueToTree(balances));
    }

    private void persistCycleMarkers() {
        writeDocument(cycleFile, objectMapper.valueToTree(cycleMarkers));
    }

    private void writeDocument(Path file, JsonNode accounts) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(VERSION_FIELD, DOCUMENT_VERSION);
        root.put(UPDATED_AT_FIELD, nowText());
        root.set(ACCOUNTS_FIELD, accounts);
        try {
            String content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            writeAtomically(file, content);
        } catch (Exception ex) {
            throw new StatePersistenceException("failed to write state file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private void writeAtomically(Path targetPath, String content) throws Exception {
        Path parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmpPath = parent.resolve(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmpPath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try {
            Files.move(tmpPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmpPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmpPath);
        }
    }

    private String nowText() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

}
