package fun.fengwk.bmh.core.service.browser.runtime;

import com.microsoft.playwright.Playwright;
import fun.fengwk.bmh.core.service.browser.BrowserProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Launches Chromium processes exposing the DevTools protocol on a local port.
 *
 * <p>Each launch gets a fresh {@code worker_<pid>_<n>} profile under the profile root which is deleted once the
 * worker terminates. Profiles whose owning pid is gone are reclaimed when the launcher is created.
 *
 * @author fengwk
 */
public class ChromiumProcessLauncher implements WorkerProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ChromiumProcessLauncher.class);

    private static final Pattern PROFILE_NAME_PATTERN = Pattern.compile("worker_(\\d+)_\\d+");

    private static final long CURRENT_PROCESS_ID = ProcessHandle.current().pid();

    private final BrowserProperties browserProperties;
    private final Path profileRoot;
    private final AtomicInteger profileCounter = new AtomicInteger(1);
    private final Map<String, Path> profileDirs = new ConcurrentHashMap<>();

    private volatile String resolvedExecutable;

    public ChromiumProcessLauncher(BrowserProperties browserProperties) {
        this.browserProperties = browserProperties;
        this.profileRoot = Paths.get(browserProperties.getProfileRoot()).toAbsolutePath().normalize();
        reclaimOrphanProfiles();
    }

    @Override
    public Process launch(String workerId, int port) throws IOException {
        Path userDataDir = profileRoot.resolve(nextProfileName());
        Files.createDirectories(userDataDir);
        profileDirs.put(workerId, userDataDir);

        List<String> command = buildCommand(resolveExecutable(), port, userDataDir);
        log.debug("launching worker browser, workerId={}, port={}, userDataDir={}", workerId, port, userDataDir);
        return new ProcessBuilder(command)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .start();
    }

    @Override
    public void afterTermination(String workerId) {
        Path userDataDir = profileDirs.remove(workerId);
        if (userDataDir != null) {
            deleteProfileDir(userDataDir);
        }
    }

    String nextProfileName() {
        return "worker_" + CURRENT_PROCESS_ID + "_" + profileCounter.getAndIncrement();
    }

    List<String> buildCommand(String executable, int port, Path userDataDir) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--remote-debugging-port=" + port);
        command.add("--remote-debugging-address=127.0.0.1");
        command.add("--user-data-dir=" + userDataDir);
        command.add("--no-first-run");
        command.add("--no-default-browser-check");
        command.add("--disable-gpu");
        command.add("--disable-dev-shm-usage");
        command.add("--disable-extensions");
        command.add("--disable-background-networking");
        int[] viewport = browserProperties.resolveViewport();
        command.add("--window-size=" + viewport[0] + "," + viewport[1]);
        if (browserProperties.isHeadless()) {
            command.add("--headless=new");
        }
        if (browserProperties.getUserAgent() != null && !browserProperties.getUserAgent().isBlank()) {
            command.add("--user-agent=" + browserProperties.getUserAgent());
        }
        if (browserProperties.isDisableImages()) {
            command.add("--blink-settings=imagesEnabled=false");
        }
        if (browserProperties.getLaunchArgs() != null) {
            command.addAll(browserProperties.getLaunchArgs());
        }
        command.add("about:blank");
        return command;
    }

    private String resolveExecutable() {
        String configured = browserProperties.getExecutablePath();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (resolvedExecutable == null) {
            synchronized (this) {
                if (resolvedExecutable == null) {
                    // Playwright downloads its bundled Chromium on first use.
                    try (Playwright playwright = Playwright.create()) {
                        resolvedExecutable = playwright.chromium().executablePath();
                    }
                    log.info("resolved bundled chromium executable, path={}", resolvedExecutable);
                }
            }
        }
        return resolvedExecutable;
    }

    /**
     * Deletes profiles left behind by monitor processes that no longer run.
     *
     * @return number of profiles deleted
     */
    int reclaimOrphanProfiles() {
        try {
            Files.createDirectories(profileRoot);
        } catch (IOException ex) {
            throw new IllegalStateException("cannot create browser profile root " + profileRoot + ": " + ex.getMessage(), ex);
        }

        List<Path> orphans = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(profileRoot, Files::isDirectory)) {
            for (Path entry : entries) {
                OptionalLong owner = profileOwnerPid(entry.getFileName().toString());
                if (owner.isPresent() && owner.getAsLong() != CURRENT_PROCESS_ID && !isProcessAlive(owner.getAsLong())) {
                    orphans.add(entry);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("cannot list browser profile root " + profileRoot + ": " + ex.getMessage(), ex);
        }

        orphans.forEach(this::deleteProfileDir);
        if (!orphans.isEmpty()) {
            log.info("reclaimed orphan browser profiles, profileRoot={}, count={}", profileRoot, orphans.size());
        }
        return orphans.size();
    }

    /**
     * Pid that created a profile named by {@link #nextProfileName()}, empty for any other directory.
     */
    static OptionalLong profileOwnerPid(String profileName) {
        Matcher matcher = PROFILE_NAME_PATTERN.matcher(profileName);
        return matcher.matches() ? OptionalLong.of(Long.parseLong(matcher.group(1))) : OptionalLong.empty();
    }

    private void deleteProfileDir(Path profileDir) {
        if (!Files.exists(profileDir)) {
            return;
        }
        try {
            Files.walkFileTree(profileDir, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }

            });
        } catch (IOException ex) {
            log.warn("delete browser profile failed, profileDir={}, error={}", profileDir, ex.getMessage());
        }
    }

    private boolean isProcessAlive(long pid) {
        return ProcessHandle.of(pid)
            .map(ProcessHandle::isAlive)
            .orElse(false);
    }

}
