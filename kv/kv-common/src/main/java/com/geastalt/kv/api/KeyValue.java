/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.api;

import java.util.Objects;

/**
 * A single key-value pair as stored by the replicated state machine.
 */
public record KeyValue(String key, String value) {

    public static final int MAX_KEY_LENGTH = 512;

    public KeyValue {
        Objects.requireNonNull(key, "key must not be null");
    }

    /**
     * Validates key format: non-blank, bounded length, no control characters.
     */
    public static boolean isValidKey(String key) {
        if (key == null || key.isBlank() || key.length() > MAX_KEY_LENGTH) {
            return false;
        }
        return key.chars().noneMatch(Character::isISOControl);
    }
}
