package in.signalbridge.infrastructure.gateway.paper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file persistence for the paper ledger so a restart keeps the simulated balance.
 *
 * Writes go to a temp file that is then moved over the target. Saves are serialized
 * so concurrent writers never share the temp file.
 */
public final class PaperLedgerStore {
    private static final Logger log = LoggerFactory.getLogger(PaperLedgerStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public PaperLedgerStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    public Optional<PaperLedgerSnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            PaperLedgerSnapshot snapshot = mapper.readValue(file.toFile(), PaperLedgerSnapshot.class);
            log.info("[PAPER] Restored ledger from {} (balance {})", file, snapshot.balance());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable paper ledger file " + file + ": " + e.getMessage(), e);
        }
    }

    public synchronized void save(PaperLedgerSnapshot snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("[PAPER] Failed to persist ledger to {}: {}", file, e.getMessage(), e);
        }
    }

    public Path file() {
        return file;
    }
}
