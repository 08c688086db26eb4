package me.golemcore.recall.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic text-match heuristic for backends that return raw content
 * without a native score.
 *
 * <ul>
 * <li>2 points per word-boundary occurrence of each query token longer than 2
 * characters</li>
 * <li>+1.5 per distinct matched token when more than one token matched</li>
 * <li>+10 when a multi-token query appears verbatim in the content</li>
 * </ul>
 *
 * Backends sharing this heuristic produce comparable scores, so the arithmetic
 * must not change.
 */
@Service
public class TermOverlapScorer {

    static final int MIN_TOKEN_LENGTH = 3;
    static final double POINTS_PER_OCCURRENCE = 2.0;
    static final double MULTI_MATCH_BONUS = 1.5;
    static final double PHRASE_MATCH_BONUS = 10.0;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    public double score(String query, String content) {
        if (content == null || content.isEmpty() || query == null || query.isBlank()) {
            return 0.0;
        }

        String queryLower = query.toLowerCase(Locale.ROOT);
        String contentLower = content.toLowerCase(Locale.ROOT);
        List<String> tokens = tokenize(queryLower);

        double score = 0.0;
        int distinctMatches = 0;
        for (String token : tokens) {
            if (token.length() < MIN_TOKEN_LENGTH) {
                continue;
            }
            int occurrences = countWordOccurrences(token, contentLower);
            score += occurrences * POINTS_PER_OCCURRENCE;
            if (occurrences > 0) {
                distinctMatches++;
            }
        }

        if (distinctMatches > 1) {
            score += distinctMatches * MULTI_MATCH_BONUS;
        }

        if (tokens.size() > 1 && contentLower.contains(queryLower)) {
            score += PHRASE_MATCH_BONUS;
        }

        return score;
    }

    List<String> tokenize(String queryLower) {
        List<String> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(queryLower.trim())) {
            if (!raw.isEmpty()) {
                tokens.add(raw);
            }
        }
        return tokens;
    }

    // Word characters are Unicode letters, digits and underscore on every JDK.
    private int countWordOccurrences(String token, String contentLower) {
        Matcher matcher = Pattern.compile(WORD_START + Pattern.quote(token) + WORD_END).matcher(contentLower);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
