package com.evfinder.domain.service;

import com.evfinder.domain.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.evfinder.testing.Fixtures.outcomes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OddsNormalizer.
 */
class OddsNormalizerTest {

    private final OddsNormalizer normalizer = new OddsNormalizer();

    @Test
    void testImpliedProbability() {
        assertEquals(0.5, normalizer.impliedProbability(2.0), 1e-12);
        assertEquals(0.0, normalizer.impliedProbability(0.0), 1e-12);
        assertEquals(0.0, normalizer.impliedProbability(-1.5), 1e-12);
    }

    @Test
    void testDevigSumsToOne() {
        List<List<Outcome>> markets = List.of(
            outcomes("Home", 2.0, "Draw", 3.5, "Away", 4.0),
            outcomes("Over", 1.9, "Under", 1.95),
            outcomes("A", 1.01, "B", 25.0),
            outcomes("1", 2.7, "X", 3.1, "2", 2.9)
        );

        for (List<Outcome> market : markets) {
            List<Outcome> devigged = normalizer.devig(market);
            double total = devigged.stream().mapToDouble(Outcome::getFairProb).sum();
            assertEquals(1.0, total, 1e-9);
        }
    }

    @Test
    void testDevigKeepsOrderAndSetsImpliedProbabilities() {
        List<Outcome> devigged = normalizer.devig(outcomes("Arsenal", 1.6, "Draw", 4.0, "Chelsea", 6.0));

        assertEquals(3, devigged.size());
        assertEquals("Arsenal", devigged.get(0).getName());
        assertEquals(0.625, devigged.get(0).getImpliedProb(), 1e-12);
        assertEquals(0.6, devigged.get(0).getFairProb(), 1e-9);
        assertEquals(0.24, devigged.get(1).getFairProb(), 1e-9);
        assertEquals(0.16, devigged.get(2).getFairProb(), 1e-9);
    }

    @Test
    void testDevigDoesNotModifyInput() {
        List<Outcome> market = outcomes("Home", 2.0, "Away", 2.0);
        normalizer.devig(market);
        assertNull(market.get(0).getFairProb());
    }

    @Test
    void testDevigWithUnusableOddsReturnsInput() {
        List<Outcome> market = outcomes("Home", 0.0, "Away", 0.0);
        assertSame(market, normalizer.devig(market));
    }

    @Test
    void testOverround() {
        assertEquals(1.0, normalizer.overround(outcomes("Home", 2.0, "Away", 2.0)), 1e-12);
        assertEquals(1.0 / 1.9 + 1.0 / 1.95, normalizer.overround(outcomes("Over", 1.9, "Under", 1.95)), 1e-12);
    }
}
