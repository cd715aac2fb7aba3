package com.horae.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates invocation identifiers: 15 random lowercase letters.
 * Opaque tags, unique enough to tell runs apart in logs.
 */
public final class InvocationIds {

    public static final int LENGTH = 15;

    private InvocationIds() {
    }

    public static String newId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        char[] letters = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            letters[i] = (char) ('a' + random.nextInt(26));
        }
        return new String(letters);
    }
}
