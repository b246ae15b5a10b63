package com.aporkolab.agentbus.transport;

/**
 * Topic-exchange binding semantics: words are separated by dots,
 * {@code *} matches exactly one word and {@code #} matches zero or more words.
 */
public final class TopicPattern {

    private TopicPattern() {
    }

    public static boolean matches(String bindingPattern, String routingKey) {
        if (bindingPattern == null || routingKey == null) {
            return false;
        }
        String[] pattern = bindingPattern.split("\\.", -1);
        String[] key = routingKey.split("\\.", -1);
        return matches(pattern, 0, key, 0);
    }

    private static boolean matches(String[] pattern, int p, String[] key, int k) {
        if (p == pattern.length) {
            return k == key.length;
        }
        String word = pattern[p];
        if ("#".equals(word)) {
            // # may swallow any number of words, including none
            for (int skip = k; skip <= key.length; skip++) {
                if (matches(pattern, p + 1, key, skip)) {
                    return true;
                }
            }
            return false;
        }
        if (k == key.length) {
            return false;
        }
        if ("*".equals(word) || word.equals(key[k])) {
            return matches(pattern, p + 1, key, k + 1);
        }
        return false;
    }
}
