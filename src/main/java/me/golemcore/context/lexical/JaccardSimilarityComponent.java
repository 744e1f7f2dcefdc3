package me.golemcore.context.lexical;

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

import me.golemcore.context.domain.component.SimilarityComponent;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default {@link SimilarityComponent}: Jaccard index over case-insensitive
 * whitespace token sets.
 *
 * <p>
 * Tokens shorter than three characters are ignored. Two empty token sets are
 * identical (1.0); an empty set against a non-empty one is disjoint (0.0).
 *
 * @since 1.0
 */
@Component
public class JaccardSimilarityComponent implements SimilarityComponent {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_TOKEN_LENGTH = 3;

    @Override
    public double similarity(String first, String second) {
        Set<String> firstTokens = tokenize(first);
        Set<String> secondTokens = tokenize(second);

        if (firstTokens.isEmpty() && secondTokens.isEmpty()) {
            return 1.0;
        }
        if (firstTokens.isEmpty() || secondTokens.isEmpty()) {
            return 0.0;
        }

        int intersection = 0;
        for (String token : firstTokens) {
            if (secondTokens.contains(token)) {
                intersection++;
            }
        }
        int union = firstTokens.size() + secondTokens.size() - intersection;
        return (double) intersection / (double) union;
    }

    Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
