package com.evfinder.domain.service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword sets that classify outcome labels across languages.
 *
 * Over/under and BTTS sides are found by substring match on the lowercase, accent-free label,
 * checking the positive side (over, yes) first. Draw synonyms are compared against the whole
 * normalized name.
 */
public class MarketKeywords {

    public enum TotalsSide { OVER, UNDER }

    public enum BttsSide { YES, NO }

    public static final List<String> DEFAULT_OVER = List.of("over", "plus", "more", "mais", "mas de");
    public static final List<String> DEFAULT_UNDER = List.of("under", "moins", "less", "fewer", "menos");
    public static final List<String> DEFAULT_YES = List.of("yes", "oui", "sim");
    public static final List<String> DEFAULT_NO = List.of("no", "non", "nao");
    public static final List<String> DEFAULT_DRAW = List.of("draw", "nul", "match nul", "x", "tie");

    private final Set<String> over;
    private final Set<String> under;
    private final Set<String> yes;
    private final Set<String> no;
    private final Set<String> draw;

    public MarketKeywords(Collection<String> over, Collection<String> under,
                          Collection<String> yes, Collection<String> no, Collection<String> draw) {
        this.over = labels(over);
        this.under = labels(under);
        this.yes = labels(yes);
        this.no = labels(no);
        this.draw = names(draw);
    }

    public static MarketKeywords defaults() {
        return new MarketKeywords(DEFAULT_OVER, DEFAULT_UNDER, DEFAULT_YES, DEFAULT_NO, DEFAULT_DRAW);
    }

    /**
     * @return the side of an over/under label, or null when the label names neither
     */
    public TotalsSide totalsSide(String label) {
        String normalized = NormalizationUtils.normalizeLabel(label);
        if (containsAny(normalized, over)) {
            return TotalsSide.OVER;
        }
        if (containsAny(normalized, under)) {
            return TotalsSide.UNDER;
        }
        return null;
    }

    /**
     * @return the side of a both-teams-to-score label, or null when the label names neither
     */
    public BttsSide bttsSide(String label) {
        String normalized = NormalizationUtils.normalizeLabel(label);
        if (containsAny(normalized, yes)) {
            return BttsSide.YES;
        }
        if (containsAny(normalized, no)) {
            return BttsSide.NO;
        }
        return null;
    }

    /**
     * True when the name, once normalized, is one of the draw synonyms ("Match nul", "X", ...).
     */
    public boolean isDraw(String name) {
        return draw.contains(NormalizationUtils.normalizeName(name));
    }

    private static boolean containsAny(String text, Set<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> labels(Collection<String> keywords) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                String label = NormalizationUtils.normalizeLabel(keyword);
                if (!label.isEmpty()) {
                    normalized.add(label);
                }
            }
        }
        return normalized;
    }

    private static Set<String> names(Collection<String> keywords) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                String name = NormalizationUtils.normalizeName(keyword);
                if (!name.isEmpty()) {
                    normalized.add(name);
                }
            }
        }
        return normalized;
    }
}
