package com.evfinder.domain.ports;

/**
 * Similarity between two already-normalized strings.
 */
@FunctionalInterface
public interface StringSimilarity {

    /**
     * @return a score in [0, 1], 1 meaning identical
     */
    double similarity(String a, String b);
}
