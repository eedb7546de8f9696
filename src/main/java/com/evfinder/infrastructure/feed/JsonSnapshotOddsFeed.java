package com.evfinder.infrastructure.feed;

import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.MarketType;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.ports.ReferenceOddsGateway;
import com.evfinder.domain.ports.TargetOddsGateway;
import com.evfinder.domain.service.OddsNormalizer;
import com.evfinder.infrastructure.config.EvFinderProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Odds source backed by JSON snapshots on disk.
 *
 * {@code target-events.json} holds the target bookmaker markets and {@code reference-<sportKey>.json}
 * the consensus markets of one sport. Both are arrays of snake_case event objects.
 */
@Component
public class JsonSnapshotOddsFeed implements TargetOddsGateway, ReferenceOddsGateway {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotOddsFeed.class);

    static final String TARGET_FILE = "target-events.json";
    static final String REFERENCE_FILE_PATTERN = "reference-%s.json";

    /** Sharp books price with a small margin; anything outside this range is a scraping error. */
    static final double MIN_REFERENCE_MARGIN = 0.97;
    static final double MAX_REFERENCE_MARGIN = 1.06;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path dir;
    private final String providerName;
    private final OddsNormalizer oddsNormalizer;

    @Autowired
    public JsonSnapshotOddsFeed(EvFinderProperties properties, OddsNormalizer oddsNormalizer) {
        this(Paths.get(properties.getFeed().getDir()), properties.getFeed().getProviderName(), oddsNormalizer);
    }

    public JsonSnapshotOddsFeed(Path dir, String providerName, OddsNormalizer oddsNormalizer) {
        this.dir = dir;
        this.providerName = providerName;
        this.oddsNormalizer = oddsNormalizer;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public List<MarketEvent> fetchTargetEvents() throws IOException {
        List<MarketEvent> events = read(dir.resolve(TARGET_FILE), new TypeReference<List<MarketEvent>>() { });
        List<MarketEvent> usable = new ArrayList<>();
        for (MarketEvent event : events) {
            complete(event);
            if (event.getOutcomes().size() >= 2) {
                event.setSource(event.getSource() != null ? event.getSource() : providerName);
                usable.add(event);
            }
        }
        logger.info("Loaded {} target events from {}", usable.size(), dir.resolve(TARGET_FILE));
        return usable;
    }

    @Override
    public List<ReferenceEvent> fetchReferenceEvents(String sportKey, String marketFilter) throws IOException {
        Path file = dir.resolve(String.format(REFERENCE_FILE_PATTERN, sportKey));
        List<ReferenceEvent> events = read(file, new TypeReference<List<ReferenceEvent>>() { });

        List<ReferenceEvent> usable = new ArrayList<>();
        int suspect = 0;
        for (ReferenceEvent event : events) {
            complete(event);
            if (event.getSportKey() == null) {
                event.setSportKey(sportKey);
            }
            if (event.getOutcomes().size() < 2 || !matchesFilter(event.getMarketType(), marketFilter)) {
                continue;
            }
            double margin = oddsNormalizer.overround(event.getOutcomes());
            if (margin < MIN_REFERENCE_MARGIN || margin > MAX_REFERENCE_MARGIN) {
                suspect++;
                continue;
            }
            usable.add(event);
        }
        if (suspect > 0) {
            logger.warn("Discarded {} reference events of {} with a suspect margin", suspect, sportKey);
        }
        return usable;
    }

    /**
     * Fills in the market type and line when the snapshot only carries the market key.
     */
    static void complete(MarketEvent event) {
        if (event.getMarketType() == MarketType.UNKNOWN) {
            event.setMarketType(MarketType.fromMarketKey(event.getMarket()));
        }
        if (event.getMarketType() == MarketType.OVER_UNDER && event.getThreshold() == null) {
            event.setThreshold(parseThreshold(event.getMarket()));
        }
    }

    /**
     * Reads the line from keys such as "over_under_2.5"; null when there is none.
     */
    static Double parseThreshold(String market) {
        if (market == null) {
            return null;
        }
        int separator = market.lastIndexOf('_');
        if (separator < 0 || separator == market.length() - 1) {
            return null;
        }
        try {
            return Double.valueOf(market.substring(separator + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean matchesFilter(MarketType type, String marketFilter) {
        if (marketFilter == null || marketFilter.isBlank() || "all".equalsIgnoreCase(marketFilter)) {
            return true;
        }
        for (String key : marketFilter.toLowerCase(Locale.ROOT).split(",")) {
            MarketType wanted = MarketType.fromKey(key.trim());
            if (wanted == type || (wanted.isHeadToHead() && type.isHeadToHead())) {
                return true;
            }
        }
        return false;
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) throws IOException {
        if (!Files.exists(file)) {
            logger.debug("No snapshot at {}", file);
            return List.of();
        }
        List<T> events = OBJECT_MAPPER.readValue(file.toFile(), type);
        return events == null ? List.of() : events;
    }
}
