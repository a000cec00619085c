package com.heist.backend.service.signal;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scores launch chatter by keyword weight plus capped punctuation, emoji and shouting bonuses.
 */
@Component
public class HypeScorer {

    static final Map<String, Integer> KEYWORD_WEIGHTS;

    static {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("launch", 10);
        weights.put("presale", 10);
        weights.put("stealth launch", 15);
        weights.put("fair launch", 12);
        weights.put("moon", 8);
        weights.put("100x", 10);
        weights.put("1000x", 12);
        weights.put("gem", 7);
        weights.put("alpha", 9);
        weights.put("call", 8);
        weights.put("pump", 6);
        weights.put("bullish", 5);
        weights.put("buy now", 7);
        weights.put("entry", 6);
        weights.put("degen", 5);
        weights.put("ca:", 15);
        weights.put("contract", 12);
        weights.put("0x", 10);
        KEYWORD_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    static final int EXCLAMATION_CAP = 10;
    static final int EMOJI_CAP = 5;
    static final int CAPS_CAP = 15;
    private static final int EMOJI_CODE_POINT_FLOOR = 127000;

    public int score(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return keywordScore(text) + exclamationBonus(text) + emojiBonus(text) + capsBonus(text);
    }

    /** Each keyword counts once regardless of repetition; overlapping keywords all count. */
    int keywordScore(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int score = 0;
        for (Map.Entry<String, Integer> entry : KEYWORD_WEIGHTS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                score += entry.getValue();
            }
        }
        return score;
    }

    int exclamationBonus(String text) {
        long count = text.chars().filter(c -> c == '!').count();
        return (int) Math.min(count * 2, EXCLAMATION_CAP);
    }

    int emojiBonus(String text) {
        long count = text.codePoints().filter(cp -> cp > EMOJI_CODE_POINT_FLOOR).count();
        return (int) Math.min(count, EMOJI_CAP);
    }

    int capsBonus(String text) {
        int count = 0;
        for (String word : text.trim().split("\\s+")) {
            if (word.codePointCount(0, word.length()) > 2 && isShouted(word)) {
                count++;
            }
        }
        return Math.min(count * 3, CAPS_CAP);
    }

    // at least one cased letter and no lowercase ones
    private boolean isShouted(String word) {
        boolean hasUpper = false;
        for (int i = 0; i < word.length(); ) {
            int cp = word.codePointAt(i);
            if (Character.isLowerCase(cp)) {
                return false;
            }
            if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
                hasUpper = true;
            }
            i += Character.charCount(cp);
        }
        return hasUpper;
    }
}
