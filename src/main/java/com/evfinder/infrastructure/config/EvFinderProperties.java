package com.evfinder.infrastructure.config;

import com.evfinder.domain.service.MarketKeywords;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code evfinder.*} properties.
 */
@ConfigurationProperties(prefix = "evfinder")
public class EvFinderProperties {

    private Detection detection = new Detection();
    private Staking staking = new Staking();
    private Settlement settlement = new Settlement();
    private Ledger ledger = new Ledger();
    private Keywords keywords = new Keywords();
    private Feed feed = new Feed();
    private Results results = new Results();

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection;
    }

    public Staking getStaking() {
        return staking;
    }

    public void setStaking(Staking staking) {
        this.staking = staking;
    }

    public Settlement getSettlement() {
        return settlement;
    }

    public void setSettlement(Settlement settlement) {
        this.settlement = settlement;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public void setLedger(Ledger ledger) {
        this.ledger = ledger;
    }

    public Keywords getKeywords() {
        return keywords;
    }

    public void setKeywords(Keywords keywords) {
        this.keywords = keywords;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    public static class Detection {

        /** Value bets must beat this EV percentage. */
        private double minEvThreshold = 0.0;
        private double matchThreshold = 0.55;
        private double outcomeThreshold = 0.5;
        /** Market filter sent to the reference source. */
        private String referenceMarkets = "h2h";
        private Duration cacheDuration = Duration.ofSeconds(120);
        private boolean refreshOnStartup = true;

        public double getMinEvThreshold() {
            return minEvThreshold;
        }

        public void setMinEvThreshold(double minEvThreshold) {
            this.minEvThreshold = minEvThreshold;
        }

        public double getMatchThreshold() {
            return matchThreshold;
        }

        public void setMatchThreshold(double matchThreshold) {
            this.matchThreshold = matchThreshold;
        }

        public double getOutcomeThreshold() {
            return outcomeThreshold;
        }

        public void setOutcomeThreshold(double outcomeThreshold) {
            this.outcomeThreshold = outcomeThreshold;
        }

        public String getReferenceMarkets() {
            return referenceMarkets;
        }

        public void setReferenceMarkets(String referenceMarkets) {
            this.referenceMarkets = referenceMarkets;
        }

        public Duration getCacheDuration() {
            return cacheDuration;
        }

        public void setCacheDuration(Duration cacheDuration) {
            this.cacheDuration = cacheDuration;
        }

        public boolean isRefreshOnStartup() {
            return refreshOnStartup;
        }

        public void setRefreshOnStartup(boolean refreshOnStartup) {
            this.refreshOnStartup = refreshOnStartup;
        }
    }

    public static class Staking {

        private BigDecimal initialBankroll = new BigDecimal("100.00");
        private double kellyFraction = 0.25;
        private double maxStakePercent = 0.05;
        private BigDecimal minStake = new BigDecimal("0.10");
        private double minEvToBet = 1.0;
        private int minBooksToBet = 3;
        private boolean autoBet = true;

        public BigDecimal getInitialBankroll() {
            return initialBankroll;
        }

        public void setInitialBankroll(BigDecimal initialBankroll) {
            this.initialBankroll = initialBankroll;
        }

        public double getKellyFraction() {
            return kellyFraction;
        }

        public void setKellyFraction(double kellyFraction) {
            this.kellyFraction = kellyFraction;
        }

        public double getMaxStakePercent() {
            return maxStakePercent;
        }

        public void setMaxStakePercent(double maxStakePercent) {
            this.maxStakePercent = maxStakePercent;
        }

        public BigDecimal getMinStake() {
            return minStake;
        }

        public void setMinStake(BigDecimal minStake) {
            this.minStake = minStake;
        }

        public double getMinEvToBet() {
            return minEvToBet;
        }

        public void setMinEvToBet(double minEvToBet) {
            this.minEvToBet = minEvToBet;
        }

        public int getMinBooksToBet() {
            return minBooksToBet;
        }

        public void setMinBooksToBet(int minBooksToBet) {
            this.minBooksToBet = minBooksToBet;
        }

        public boolean isAutoBet() {
            return autoBet;
        }

        public void setAutoBet(boolean autoBet) {
            this.autoBet = autoBet;
        }
    }

    public static class Settlement {

        /** Matches that kicked off less than this long ago are not looked up. */
        private Duration inProgressWindow = Duration.ofHours(2);
        private int recentBetsLimit = 50;

        public Duration getInProgressWindow() {
            return inProgressWindow;
        }

        public void setInProgressWindow(Duration inProgressWindow) {
            this.inProgressWindow = inProgressWindow;
        }

        public int getRecentBetsLimit() {
            return recentBetsLimit;
        }

        public void setRecentBetsLimit(int recentBetsLimit) {
            this.recentBetsLimit = recentBetsLimit;
        }
    }

    public static class Ledger {

        /** "file" or "mongo". */
        private String store = "file";
        private String file = "data/bankroll.json";
        /** Document id of the ledger when stored in MongoDB. */
        private String id = "default";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }
    }

    public static class Keywords {

        private List<String> over = new ArrayList<>(MarketKeywords.DEFAULT_OVER);
        private List<String> under = new ArrayList<>(MarketKeywords.DEFAULT_UNDER);
        private List<String> yes = new ArrayList<>(MarketKeywords.DEFAULT_YES);
        private List<String> no = new ArrayList<>(MarketKeywords.DEFAULT_NO);
        private List<String> draw = new ArrayList<>(MarketKeywords.DEFAULT_DRAW);

        public List<String> getOver() {
            return over;
        }

        public void setOver(List<String> over) {
            this.over = over;
        }

        public List<String> getUnder() {
            return under;
        }

        public void setUnder(List<String> under) {
            this.under = under;
        }

        public List<String> getYes() {
            return yes;
        }

        public void setYes(List<String> yes) {
            this.yes = yes;
        }

        public List<String> getNo() {
            return no;
        }

        public void setNo(List<String> no) {
            this.no = no;
        }

        public List<String> getDraw() {
            return draw;
        }

        public void setDraw(List<String> draw) {
            this.draw = draw;
        }
    }

    public static class Feed {

        /** Directory holding target-events.json and reference-&lt;sport&gt;.json. */
        private String dir = "data/feed";
        private String providerName = "snapshot";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getProviderName() {
            return providerName;
        }

        public void setProviderName(String providerName) {
            this.providerName = providerName;
        }
    }

    public static class Results {

        private Espn espn = new Espn();

        public Espn getEspn() {
            return espn;
        }

        public void setEspn(Espn espn) {
            this.espn = espn;
        }
    }

    public static class Espn {

        private boolean enabled = true;
        private String baseUrl = "https://site.api.espn.com/apis/site/v2/sports/soccer";
        private List<String> leagues = new ArrayList<>(List.of(
            "ita.1", "esp.1", "eng.1", "ger.1", "fra.1", "por.1", "ned.1",
            "tur.1", "bel.1", "sco.1", "ita.2", "esp.2", "eng.2", "ger.2", "fra.2",
            "uefa.champions", "uefa.europa", "uefa.europa_conference",
            "eng.fa", "ger.dfb_pokal", "esp.copa_del_rey", "ita.coppa_italia",
            "fra.coupe_de_france", "eng.league_cup"
        ));
        private double nameThreshold = 0.65;
        private Duration timeout = Duration.ofSeconds(6);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public List<String> getLeagues() {
            return leagues;
        }

        public void setLeagues(List<String> leagues) {
            this.leagues = leagues;
        }

        public double getNameThreshold() {
            return nameThreshold;
        }

        public void setNameThreshold(double nameThreshold) {
            this.nameThreshold = nameThreshold;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
