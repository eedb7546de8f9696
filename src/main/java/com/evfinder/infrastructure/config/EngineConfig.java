package com.evfinder.infrastructure.config;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.application.state.RefreshState;
import com.evfinder.application.usecase.DetectionSettings;
import com.evfinder.application.usecase.SettlementSettings;
import com.evfinder.domain.ports.LedgerRepository;
import com.evfinder.domain.ports.StringSimilarity;
import com.evfinder.domain.service.BankrollSummaryProjection;
import com.evfinder.domain.service.BetResultEvaluator;
import com.evfinder.domain.service.EventMatcher;
import com.evfinder.domain.service.KellyCalculator;
import com.evfinder.domain.service.MarketKeywords;
import com.evfinder.domain.service.OddsNormalizer;
import com.evfinder.domain.service.SequenceMatcherSimilarity;
import com.evfinder.domain.service.StakingRules;
import com.evfinder.domain.service.ValueBetDetector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine services from {@link EvFinderProperties}.
 */
@Configuration
@EnableConfigurationProperties(EvFinderProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StringSimilarity stringSimilarity() {
        return new SequenceMatcherSimilarity();
    }

    @Bean
    public MarketKeywords marketKeywords(EvFinderProperties properties) {
        EvFinderProperties.Keywords keywords = properties.getKeywords();
        return new MarketKeywords(keywords.getOver(), keywords.getUnder(), keywords.getYes(), keywords.getNo(),
            keywords.getDraw());
    }

    @Bean
    public OddsNormalizer oddsNormalizer() {
        return new OddsNormalizer();
    }

    @Bean
    public EventMatcher eventMatcher(StringSimilarity similarity, EvFinderProperties properties) {
        return new EventMatcher(similarity, properties.getDetection().getMatchThreshold());
    }

    @Bean
    public ValueBetDetector valueBetDetector(OddsNormalizer oddsNormalizer, EventMatcher eventMatcher,
                                             StringSimilarity similarity, MarketKeywords keywords,
                                             EvFinderProperties properties) {
        return new ValueBetDetector(oddsNormalizer, eventMatcher, similarity, keywords,
            properties.getDetection().getOutcomeThreshold());
    }

    @Bean
    public DetectionSettings detectionSettings(EvFinderProperties properties) {
        EvFinderProperties.Detection detection = properties.getDetection();
        return new DetectionSettings(detection.getMinEvThreshold(), detection.getReferenceMarkets(),
            detection.getCacheDuration());
    }

    @Bean
    public StakingRules stakingRules(EvFinderProperties properties) {
        EvFinderProperties.Staking staking = properties.getStaking();
        return new StakingRules(
            staking.getKellyFraction(),
            staking.getMaxStakePercent(),
            staking.getMinStake(),
            staking.getMinEvToBet(),
            staking.getMinBooksToBet(),
            staking.isAutoBet(),
            staking.getInitialBankroll()
        );
    }

    @Bean
    public KellyCalculator kellyCalculator(StakingRules rules) {
        return new KellyCalculator(rules);
    }

    @Bean
    public BetResultEvaluator betResultEvaluator(MarketKeywords keywords) {
        return new BetResultEvaluator(keywords);
    }

    @Bean
    public SettlementSettings settlementSettings(EvFinderProperties properties) {
        return new SettlementSettings(properties.getSettlement().getInProgressWindow());
    }

    @Bean
    public BankrollSummaryProjection bankrollSummaryProjection(EvFinderProperties properties) {
        return new BankrollSummaryProjection(properties.getSettlement().getRecentBetsLimit());
    }

    @Bean
    public LedgerStore ledgerStore(LedgerRepository repository, Clock clock, StakingRules rules) {
        return new LedgerStore(repository, clock, rules.initialBankroll());
    }

    @Bean
    public RefreshState refreshState(Clock clock) {
        return new RefreshState(clock);
    }
}
