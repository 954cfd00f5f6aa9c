package io.github.drompincen.promptgate.protocol.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * One empty file per marked session. The mark is written to a temp file and moved into place so
 * readers never see a half-created sentinel; consuming is a single {@code deleteIfExists}, which the
 * file system serializes between racing processes. The gateway and the hook share this layout.
 */
public class FileSentinelSignalChannel implements SignalChannel {

    private static final Logger log = LoggerFactory.getLogger(FileSentinelSignalChannel.class);

    public static final String PREFIX = "promptgate-plan-approved-";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    public FileSentinelSignalChannel(Path directory) {
        this.directory = directory;
    }

    @Override
    public void mark(String sessionId) {
        Path target = sentinel(sessionId);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, ".mark-", ".tmp");
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Marked sentinel {}", target.getFileName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to mark sentinel for session " + sessionId, e);
        }
    }

    @Override
    public boolean check(String sessionId) {
        return Files.exists(sentinel(sessionId));
    }

    @Override
    public boolean consume(String sessionId) {
        Path target = sentinel(sessionId);
        try {
            boolean consumed = Files.deleteIfExists(target);
            if (consumed) {
                log.info("Consumed sentinel {}", target.getFileName());
            }
            return consumed;
        } catch (IOException e) {
            log.warn("Could not consume sentinel {}: {}", target, e.getMessage());
            return false;
        }
    }

    public Path directory() {
        return directory;
    }

    Path sentinel(String sessionId) {
        return directory.resolve(PREFIX + fileSafe(sessionId));
    }

    /** Ids that could escape the directory are replaced by a stable name-based UUID. */
    static String fileSafe(String sessionId) {
        if (SAFE_ID.matcher(sessionId).matches() && !sessionId.startsWith(".")) {
            return sessionId;
        }
        return UUID.nameUUIDFromBytes(sessionId.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
