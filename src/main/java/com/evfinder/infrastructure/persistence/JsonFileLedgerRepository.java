package com.evfinder.infrastructure.persistence;

import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.ports.LedgerPersistenceException;
import com.evfinder.domain.ports.LedgerRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the ledger as one JSON file.
 *
 * Saves write a sibling temp file and move it over the target, so a crash mid-write never
 * leaves a truncated ledger behind.
 */
@Repository
@ConditionalOnProperty(name = "evfinder.ledger.store", havingValue = "file", matchIfMissing = true)
public class JsonFileLedgerRepository implements LedgerRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileLedgerRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper = LedgerJson.newMapper();

    @Autowired
    public JsonFileLedgerRepository(@Value("${evfinder.ledger.file:data/bankroll.json}") String file) {
        this(Paths.get(file));
    }

    public JsonFileLedgerRepository(Path file) {
        this.file = file;
    }

    @Override
    public Optional<BankrollLedger> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), BankrollLedger.class));
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to read ledger " + file, e);
        }
    }

    @Override
    public void save(BankrollLedger ledger) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tmp.toFile(), ledger);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Ledger saved to {} ({} bets)", file, ledger.getBets().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new LedgerPersistenceException("Failed to write ledger " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temp ledger file {}: {}", tmp, e.getMessage());
        }
    }
}
