package com.keer.studiosync.classifier.service;

import java.util.List;
import java.util.Optional;

/**
 * One pattern family of an extraction cascade. Cascades try their matchers in order and
 * keep the first hit, not the best one.
 */
@FunctionalInterface
public interface TextMatcher<T> {

    Optional<T> match(String text);

    static <T> Optional<T> firstMatch(List<TextMatcher<T>> matchers, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (TextMatcher<T> matcher : matchers) {
            Optional<T> result = matcher.match(text);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
