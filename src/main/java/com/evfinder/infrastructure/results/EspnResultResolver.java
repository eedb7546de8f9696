package com.evfinder.infrastructure.results;

import com.evfinder.domain.model.MatchResult;
import com.evfinder.domain.model.ResultStatus;
import com.evfinder.domain.ports.MatchResultResolver;
import com.evfinder.domain.ports.StringSimilarity;
import com.evfinder.domain.service.NormalizationUtils;
import com.evfinder.infrastructure.config.EvFinderProperties;
import com.evfinder.infrastructure.http.HttpClientUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks up finished soccer matches on the public ESPN scoreboard.
 *
 * Each configured league is queried for the kick-off date until a fixture with both teams is
 * found. French and short team names are translated to the names ESPN uses before comparing.
 */
@Component
public class EspnResultResolver implements MatchResultResolver {

    private static final Logger logger = LoggerFactory.getLogger(EspnResultResolver.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final List<String> DRAW_OUTCOMES = List.of("Draw", "Match nul", "Nul", "X");
    private static final Map<String, String> TEAM_TRANSLATIONS = translations();

    private final EvFinderProperties.Espn settings;
    private final StringSimilarity similarity;

    public EspnResultResolver(EvFinderProperties properties, StringSimilarity similarity) {
        this.settings = properties.getResults().getEspn();
        this.similarity = similarity;
    }

    @Override
    public MatchResult resolve(String matchId, String home, String away, Instant startTime, String sport) {
        if (!settings.isEnabled() || startTime == null) {
            return null;
        }

        String date = DATE_FORMAT.format(startTime);
        for (String league : settings.getLeagues()) {
            JsonNode scoreboard;
            try {
                scoreboard = fetchScoreboard(league, date);
            } catch (IOException e) {
                logger.warn("ESPN scoreboard {} for {} unavailable: {}", league, date, e.getMessage());
                continue;
            }

            JsonNode competition = findCompetition(scoreboard, home, away);
            if (competition != null) {
                MatchResult result = toResult(competition, home, away);
                logger.debug("ESPN {}: {} vs {} -> {}", league, home, away, result);
                return result;
            }
        }
        return null;
    }

    /**
     * Fetches one league scoreboard for a date (yyyyMMdd).
     */
    protected JsonNode fetchScoreboard(String league, String date) throws IOException {
        String url = settings.getBaseUrl() + "/" + league + "/scoreboard";
        return HttpClientUtil.getJson(url, Map.of("dates", date), Map.of("User-Agent", "Mozilla/5.0"),
            settings.getTimeout());
    }

    /**
     * Finds the competition where both teams appear, in either home/away order.
     */
    JsonNode findCompetition(JsonNode scoreboard, String home, String away) {
        if (scoreboard == null) {
            return null;
        }
        for (JsonNode event : scoreboard.path("events")) {
            JsonNode competition = event.path("competitions").path(0);
            JsonNode competitors = competition.path("competitors");
            if (competitors.size() < 2) {
                continue;
            }
            String first = teamName(competitors.get(0));
            String second = teamName(competitors.get(1));

            boolean homeFound = teamsMatch(home, first) || teamsMatch(home, second);
            boolean awayFound = teamsMatch(away, first) || teamsMatch(away, second);
            if (homeFound && awayFound) {
                return competition;
            }
        }
        return null;
    }

    /**
     * Converts an ESPN competition into a result oriented to the bet's home and away teams.
     *
     * @return the result, or null when the match is scheduled but has not started
     */
    MatchResult toResult(JsonNode competition, String home, String away) {
        JsonNode type = competition.path("status").path("type");
        String statusName = type.path("name").asText("").toUpperCase(Locale.ROOT);

        if (statusName.contains("CANCEL") || statusName.contains("POSTPONE") || statusName.contains("ABANDON")) {
            return MatchResult.cancelled(home, away);
        }
        if (!type.path("completed").asBoolean(false)) {
            return "in".equals(type.path("state").asText()) ? MatchResult.live(home, away) : null;
        }

        JsonNode competitors = competition.path("competitors");
        JsonNode first = competitors.get(0);
        JsonNode second = competitors.get(1);

        int homeGoals = first.path("score").asInt(0);
        int awayGoals = second.path("score").asInt(0);
        boolean swapped = !teamsMatch(home, teamName(first)) && teamsMatch(home, teamName(second));
        if (swapped) {
            int goals = homeGoals;
            homeGoals = awayGoals;
            awayGoals = goals;
        }

        List<String> winners;
        if (homeGoals > awayGoals) {
            winners = List.of(home);
        } else if (awayGoals > homeGoals) {
            winners = List.of(away);
        } else {
            winners = DRAW_OUTCOMES;
        }
        return new MatchResult(ResultStatus.FINISHED, homeGoals + "-" + awayGoals, winners, home, away);
    }

    boolean teamsMatch(String a, String b) {
        String first = normalizeTeam(a);
        String second = normalizeTeam(b);
        if (first.isEmpty() || second.isEmpty()) {
            return false;
        }
        if (first.equals(second) || first.contains(second) || second.contains(first)) {
            return true;
        }
        return similarity.similarity(first, second) >= settings.getNameThreshold();
    }

    static String normalizeTeam(String name) {
        String normalized = NormalizationUtils.normalizeName(name);
        return TEAM_TRANSLATIONS.getOrDefault(normalized, normalized);
    }

    private static String teamName(JsonNode competitor) {
        return competitor.path("team").path("displayName").asText("");
    }

    private static Map<String, String> translations() {
        String[][] pairs = {
            // Spain
            {"gerone", "girona"}, {"seville", "sevilla"}, {"valence", "valencia"},
            {"betis", "real betis"}, {"betis seville", "real betis"}, {"la corogne", "deportivo"},
            {"saragosse", "zaragoza"}, {"majorque", "mallorca"}, {"real societe", "real sociedad"},
            {"osasune", "osasuna"}, {"espagnol", "espanyol"},
            // England
            {"manchester city", "man city"}, {"manchester united", "man united"},
            {"manchester utd", "man united"}, {"newcastle united", "newcastle"},
            {"west ham united", "west ham"}, {"tottenham hotspur", "tottenham"}, {"spurs", "tottenham"},
            {"leicester city", "leicester"}, {"brighton & hove albion", "brighton"},
            {"wolverhampton", "wolves"},
            // Germany
            {"munich", "bayern munich"}, {"bayern", "bayern munich"}, {"leverkusen", "bayer leverkusen"},
            {"dortmund", "borussia dortmund"}, {"gladbach", "m'gladbach"}, {"cologne", "koln"},
            {"mayence", "mainz"}, {"mayence 05", "mainz"}, {"francfort", "frankfurt"},
            {"eintracht francfort", "eintracht frankfurt"}, {"stuttgart vfb", "vfb stuttgart"},
            {"fribourg", "freiburg"}, {"sc fribourg", "sc freiburg"}, {"hertha berlin", "hertha"},
            {"union berlin", "union"},
            // Italy
            {"inter milan", "inter"}, {"internazionale", "inter"}, {"ac milan", "milan"},
            {"juventus turin", "juventus"}, {"rome", "roma"}, {"as rome", "roma"}, {"naples", "napoli"},
            {"florence", "fiorentina"}, {"atalante", "atalanta"},
            // France
            {"paris", "paris saint-germain"}, {"psg", "paris saint-germain"},
            {"marseille", "olympique marseille"}, {"lyon", "olympique lyonnais"},
            {"bordeaux", "girondins bordeaux"}, {"strasbourg", "rc strasbourg"}, {"lens", "rc lens"},
            // Portugal
            {"porto", "fc porto"}, {"sporting", "sporting cp"}, {"sporting lisbonne", "sporting cp"},
            {"benfica", "sl benfica"}, {"braga", "sc braga"},
            // Netherlands
            {"ajax", "ajax amsterdam"}, {"psv", "psv eindhoven"}, {"feyenoord", "feyenoord rotterdam"},
        };

        Map<String, String> translations = new HashMap<>();
        for (String[] pair : pairs) {
            String from = NormalizationUtils.normalizeName(pair[0]);
            String to = NormalizationUtils.normalizeName(pair[1]);
            if (!from.equals(to)) {
                translations.put(from, to);
            }
        }
        return Map.copyOf(translations);
    }
}
