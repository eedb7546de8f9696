package com.evfinder.domain.service;

import com.evfinder.domain.ports.StringSimilarity;

/**
 * Ratcliff/Obershelp similarity: twice the number of characters in matching blocks
 * divided by the total length of both strings.
 *
 * Matching blocks are found by taking the longest common substring, then recursing on
 * the parts to its left and right. Ties pick the block that starts earliest in {@code a},
 * then earliest in {@code b}.
 */
public class SequenceMatcherSimilarity implements StringSimilarity {

    @Override
    public double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        int totalLength = a.length() + b.length();
        if (totalLength == 0) {
            return 1.0;
        }
        int matches = countMatches(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / totalLength;
    }

    private int countMatches(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }

        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;

        // lengths[j + 1] = length of the common suffix ending at a[i] and b[bLo + j]
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[width + 1];
            char ca = a.charAt(i);
            for (int j = 0; j < width; j++) {
                if (ca == b.charAt(bLo + j)) {
                    int size = previous[j] + 1;
                    current[j + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestI = i - size + 1;
                        bestJ = bLo + j - size + 1;
                    }
                }
            }
            previous = current;
        }

        if (bestSize == 0) {
            return 0;
        }
        return bestSize
            + countMatches(a, aLo, bestI, b, bLo, bestJ)
            + countMatches(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
