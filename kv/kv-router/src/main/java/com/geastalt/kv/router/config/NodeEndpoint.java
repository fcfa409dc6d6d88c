/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.config;

/**
 * A node the router can talk to: its member id and HTTP base URL.
 */
public record NodeEndpoint(String id, String address) {
}
