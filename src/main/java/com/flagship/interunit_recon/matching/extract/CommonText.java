package com.flagship.interunit_recon.matching.extract;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Long phrases shared verbatim by two narrations, longest first.
 */
@Value
public class CommonText {
    List<Phrase> phrases;

    public Phrase longest() {
        return phrases.get(0);
    }

    /**
     * {@code "<n> words: <phrase>"} for each phrase, joined by {@code " | "}.
     */
    public String summary() {
        return phrases.stream()
            .map(phrase -> phrase.getWordCount() + " words: " + phrase.getText())
            .collect(Collectors.joining(" | "));
    }

    @Value
    public static class Phrase {
        String text;
        int wordCount;
    }
}
