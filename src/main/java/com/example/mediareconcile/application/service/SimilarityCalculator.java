package com.example.mediareconcile.application.service;

import org.springframework.stereotype.Component;

@Component
public class SimilarityCalculator {

    /**
     * Longest-common-subsequence ratio {@code 2 * LCS(a, b) / (|a| + |b|)}.
     * Symmetric, in [0, 1]; identical strings (including two empty ones) score 1.0.
     */
    public double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0D;
        }
        return 2.0D * longestCommonSubsequence(left, right) / total;
    }

    int longestCommonSubsequence(String a, String b) {
        int m = a.length();
        int n = b.length();
        if (m == 0 || n == 0) {
            return 0;
        }
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int i = 1; i <= m; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= n; j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }
}
