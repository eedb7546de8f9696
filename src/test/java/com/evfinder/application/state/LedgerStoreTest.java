package com.evfinder.application.state;

import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.model.Bet;
import com.evfinder.domain.ports.LedgerPersistenceException;
import com.evfinder.infrastructure.persistence.JsonFileLedgerRepository;
import com.evfinder.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static com.evfinder.testing.Fixtures.NOW;
import static com.evfinder.testing.Fixtures.pendingBet;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LedgerStore.
 */
class LedgerStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FlakyRepository repository;
    private LedgerStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = new FlakyRepository(tempDir.resolve("bankroll.json"));
        store = new LedgerStore(repository, clock, new BigDecimal("100.00"));
    }

    @Test
    void testSnapshotWithoutRecordStoresFreshLedger() {
        BankrollLedger ledger = store.snapshot();

        assertEquals(new BigDecimal("100.00"), ledger.getCurrentBankroll());
        assertEquals(NOW, ledger.getCreatedAt());
        assertTrue(Files.exists(repository.getFile()));
        assertEquals(1, repository.saves);
    }

    @Test
    void testCreationTimeStaysFixedAcrossReads() {
        store.snapshot();
        clock.advance(Duration.ofHours(2));

        BankrollLedger later = store.snapshot();

        assertEquals(NOW, later.getCreatedAt());
        assertEquals(1, repository.saves);
    }

    @Test
    void testFirstUpdateKeepsCreationTimeOfFirstRead() {
        store.snapshot();
        clock.advance(Duration.ofMinutes(10));

        store.update(ledger -> {
            ledger.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW));
            return null;
        });

        assertEquals(NOW, store.snapshot().getCreatedAt());
    }

    @Test
    void testUpdatePersistsChanges() {
        clock.advance(Duration.ofMinutes(5));

        String betId = store.update(ledger -> {
            Bet bet = pendingBet("b1", "5.00", 2.0, NOW);
            ledger.addPendingBet(bet);
            return bet.getBetId();
        });

        assertEquals("b1", betId);
        BankrollLedger reloaded = store.snapshot();
        assertEquals(new BigDecimal("95.00"), reloaded.getCurrentBankroll());
        assertEquals(1, reloaded.getBets().size());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), reloaded.getLastUpdated());
    }

    @Test
    void testUpdateWithoutChangesDoesNotSave() {
        store.snapshot();
        int savesAfterFirstRead = repository.saves;

        store.update(ledger -> ledger.getBets().size());

        assertEquals(savesAfterFirstRead, repository.saves);
    }

    @Test
    void testSnapshotChangesAreNotStored() {
        BankrollLedger copy = store.snapshot();
        copy.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW));

        assertTrue(store.snapshot().getBets().isEmpty());
    }

    @Test
    void testFailedSaveKeepsPreviousRecord() {
        store.update(ledger -> {
            ledger.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW));
            return null;
        });
        repository.failing = true;

        assertThrows(LedgerPersistenceException.class, () -> store.update(ledger -> {
            ledger.addPendingBet(pendingBet("b2", "5.00", 2.0, NOW));
            return null;
        }));

        repository.failing = false;
        BankrollLedger ledger = store.snapshot();
        assertEquals(1, ledger.getBets().size());
        assertEquals(new BigDecimal("95.00"), ledger.getCurrentBankroll());
    }

    @Test
    void testReplaceStartsOver() {
        store.update(ledger -> {
            ledger.addPendingBet(pendingBet("b1", "5.00", 2.0, NOW));
            return null;
        });
        clock.advance(Duration.ofHours(1));

        BankrollLedger replaced = store.replace(new BigDecimal("500"));

        assertEquals(new BigDecimal("500.00"), replaced.getInitialBankroll());
        BankrollLedger reloaded = store.snapshot();
        assertTrue(reloaded.getBets().isEmpty());
        assertEquals(new BigDecimal("500.00"), reloaded.getCurrentBankroll());
        assertEquals(NOW.plus(Duration.ofHours(1)), reloaded.getCreatedAt());
    }

    /**
     * File repository that counts saves and can be told to fail them.
     */
    private static class FlakyRepository extends JsonFileLedgerRepository {

        int saves;
        boolean failing;

        FlakyRepository(Path file) {
            super(file);
        }

        @Override
        public void save(BankrollLedger ledger) {
            if (failing) {
                throw new LedgerPersistenceException("disk full", new IOException("No space left on device"));
            }
            saves++;
            super.save(ledger);
        }
    }
}
