package fun.fengwk.bmh.core.service.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateStore tests.
 *
 * @author fengwk
 */
class StateStoreTest {

    private static final Clock MORNING = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Path balanceFile;
    private Path cycleFile;

    @BeforeEach
    void setUp() {
        balanceFile = tempDir.resolve("balance_cache.json");
        cycleFile = tempDir.resolve("daily_web_login_state.json");
    }

    @Test
    void shouldStartEmptyWhenFilesMissing() {
        StateStore store = load(MORNING);

        assertThat(store.cachedUsernames()).isEmpty();
        assertThat(store.getCachedBalance("alice")).isEmpty();
        assertThat(store.shouldForceFull("alice")).isTrue();
        assertThat(balanceFile).doesNotExist();
        assertThat(cycleFile).doesNotExist();
    }

    @Test
    void shouldRoundTripBalancesAndMarkers() throws Exception {
        StateStore store = load(MORNING);
        store.updateBalance("alice", "$42.5", true, "synced");
        store.updateBalance("bob", "$1.0", null, null);
        store.markCycleFulfilled("alice");

        StateStore reloaded = load(MORNING);

        assertThat(reloaded.getCachedBalance("alice")).contains("$42.5");
        assertThat(reloaded.getCachedRecord("alice")).hasValueSatisfying(record -> {
            assertThat(record.getUpdatedAt()).isEqualTo("2026-03-10T09:00:00Z");
            assertThat(record.getApikeySyncSuccess()).isTrue();
            assertThat(record.getApikeySyncMessage()).isEqualTo("synced");
        });
        assertThat(reloaded.getCachedRecord("bob")).hasValueSatisfying(record ->
            assertThat(record.getApikeySyncSuccess()).isNull());
        assertThat(reloaded.getCycleMarker("alice")).contains("2026-03-10");
        assertThat(reloaded.shouldForceFull("alice")).isFalse();
        assertThat(reloaded.shouldForceFull("bob")).isTrue();

        JsonNode document = objectMapper.readTree(balanceFile.toFile());
        assertThat(document.get("version").asInt()).isEqualTo(1);
        assertThat(document.get("updated_at").asText()).isEqualTo("2026-03-10T09:00:00Z");
        assertThat(document.at("/accounts/alice/balance").asText()).isEqualTo("$42.5");
        assertThat(document.at("/accounts/bob").has("apikey_sync_success")).isFalse();
        assertThat(objectMapper.readTree(cycleFile.toFile()).at("/accounts/alice").asText()).isEqualTo("2026-03-10");
    }

    @Test
    void shouldKeepSyncMessageWhenNull() {
        StateStore store = load(MORNING);
        store.updateBalance("alice", "$1.0", false, "quota sync failed");
        store.updateBalance("alice", "$2.0", null, null);

        assertThat(store.getCachedRecord("alice")).hasValueSatisfying(record -> {
            assertThat(record.getBalance()).isEqualTo("$2.0");
            assertThat(record.getApikeySyncMessage()).isEqualTo("quota sync failed");
        });
    }

    @Test
    void shouldForceOncePerCycleDay() {
        StateStore store = load(MORNING);
        assertThat(store.shouldForceFull("alice")).isTrue();
        store.markCycleFulfilled("alice");
        assertThat(store.shouldForceFull("alice")).isFalse();

        // Next calendar morning before the rollover still belongs to the same cycle day.
        StateStore beforeRollover = load(Clock.fixed(Instant.parse("2026-03-11T07:59:00Z"), ZoneOffset.UTC));
        assertThat(beforeRollover.currentCycleDay()).isEqualTo("2026-03-10");
        assertThat(beforeRollover.shouldForceFull("alice")).isFalse();

        StateStore afterRollover = load(Clock.fixed(Instant.parse("2026-03-11T08:00:00Z"), ZoneOffset.UTC));
        assertThat(afterRollover.shouldForceFull("alice")).isTrue();
    }

    @Test
    void shouldIgnoreStaleTempFileFromCrashedWrite() throws Exception {
        StateStore store = load(MORNING);
        store.updateBalance("alice", "$5.0", null, null);
        String committed = Files.readString(balanceFile, StandardCharsets.UTF_8);

        // A crash after the temp write but before the move leaves a partial temp file behind.
        Path staleTmp = tempDir.resolve("balance_cache.json.0b6f.tmp");
        Files.writeString(staleTmp, "{\"accounts\": {\"alice\": {\"bal", StandardCharsets.UTF_8);

        StateStore reloaded = load(MORNING);

        assertThat(Files.readString(balanceFile, StandardCharsets.UTF_8)).isEqualTo(committed);
        assertThat(reloaded.getCachedBalance("alice")).contains("$5.0");
    }

    @Test
    void shouldNotLeaveTempFilesAfterWrites() throws Exception {
        StateStore store = load(MORNING);
        for (int i = 0; i < 5; i++) {
            store.updateBalance("user" + i, "$" + i + ".0", null, null);
            store.markCycleFulfilled("user" + i);
        }

        try (Stream<Path> files = Files.list(tempDir)) {
            List<String> names = files.map(path -> path.getFileName().toString()).sorted().toList();
            assertThat(names).containsExactly("balance_cache.json", "daily_web_login_state.json");
        }
    }

    @Test
    void shouldCorrectLegacyMidnightMarkers() throws Exception {
        Files.writeString(cycleFile, """
            {
              "version": 1,
              "updated_at": "2026-03-10T07:30:00+08:00",
              "accounts": {
                "alice": "2026-03-10",
                "bob": "2026-03-09"
              }
            }
            """, StandardCharsets.UTF_8);

        StateStore store = load(MORNING);

        assertThat(store.getCycleMarker("alice")).contains("2026-03-09");
        assertThat(store.getCycleMarker("bob")).contains("2026-03-09");
        JsonNode persisted = objectMapper.readTree(cycleFile.toFile());
        assertThat(persisted.at("/accounts/alice").asText()).isEqualTo("2026-03-09");
    }

    @Test
    void shouldCorrectLegacyLocalTimestamp() throws Exception {
        Files.writeString(cycleFile, """
            {"updated_at": "2026-03-10T02:00:00", "accounts": {"alice": "2026-03-10"}}
            """, StandardCharsets.UTF_8);

        StateStore store = load(MORNING);

        assertThat(store.getCycleMarker("alice")).contains("2026-03-09");
    }

    @Test
    void shouldNotCorrectMarkersSavedAfterRollover() throws Exception {
        String content = """
            {"version": 1, "updated_at": "2026-03-10T09:15:00+08:00", "accounts": {"alice": "2026-03-10"}}
            """;
        Files.writeString(cycleFile, content, StandardCharsets.UTF_8);

        StateStore store = load(MORNING);

        assertThat(store.getCycleMarker("alice")).contains("2026-03-10");
        assertThat(Files.readString(cycleFile, StandardCharsets.UTF_8)).isEqualTo(content);
    }

    @Test
    void shouldDropMalformedEntries() throws Exception {
        Files.writeString(balanceFile, """
            {"version": 1, "accounts": {
              "alice": {"balance": "$1.0", "updated_at": "2026-03-10T09:00:00Z"},
              "bob": {"balance": "  "},
              "carol": [1, 2],
              "dave": "$2.0",
              "erin": {"updated_at": "2026-03-10T09:00:00Z"}
            }}
            """, StandardCharsets.UTF_8);
        Files.writeString(cycleFile, """
            {"version": 1, "accounts": {"alice": "2026/03/10", "bob": "2026-13-40", "carol": "2026-03-10", "dave": 20260310}}
            """, StandardCharsets.UTF_8);

        StateStore store = load(MORNING);

        assertThat(store.cachedUsernames()).containsExactly("alice", "dave");
        assertThat(store.getCachedBalance("dave")).contains("$2.0");
        assertThat(store.getCycleMarker("alice")).isEmpty();
        assertThat(store.getCycleMarker("bob")).isEmpty();
        assertThat(store.getCycleMarker("carol")).contains("2026-03-10");
        assertThat(store.getCycleMarker("dave")).isEmpty();
    }

    @Test
    void shouldReadLegacyFlatLayout() throws Exception {
        Files.writeString(balanceFile, """
            {"updated_at": "2026-03-10T09:00:00Z", "alice": {"balance": "$3.0", "updated_at": "2026-03-09T10:00:00Z"}}
            """, StandardCharsets.UTF_8);
        Files.writeString(cycleFile, """
            {"version": 1, "updated_at": "2026-03-10T09:00:00Z", "alice": "2026-03-10"}
            """, StandardCharsets.UTF_8);

        StateStore store = load(MORNING);

        assertThat(store.cachedUsernames()).containsExactly("alice");
        assertThat(store.getCachedBalance("alice")).contains("$3.0");
        assertThat(store.getCycleMarker("alice")).contains("2026-03-10");
        assertThat(store.getCycleMarker("version")).isEmpty();
    }

    @Test
    void shouldFailOnUnparseableDocument() throws Exception {
        Files.writeString(balanceFile, "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> load(MORNING))
            .isInstanceOf(StatePersistenceException.class)
            .hasMessageContaining("failed to read state file");
    }

    @Test
    void shouldFallbackToDefaultRolloverHour() {
        StateStore store = StateStore.load(balanceFile, cycleFile, 42, objectMapper, MORNING);

        assertThat(store.getRolloverHour()).isEqualTo(8);
    }

    private StateStore load(Clock clock) {
        return StateStore.load(balanceFile, cycleFile, 8, objectMapper, clock);
    }

}
