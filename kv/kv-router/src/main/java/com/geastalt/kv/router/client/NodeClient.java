/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.client;

import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.api.RaftStatusView;
import com.geastalt.kv.model.KvResult;

/**
 * Calls into a single node's HTTP API. Transport failures are returned as
 * UNREACHABLE results, never thrown.
 */
public interface NodeClient {

    KvResult<KeyValue> put(String address, String key, String value, String requestId);

    KvResult<KeyValue> get(String address, String key);

    KvResult<KeyValue> delete(String address, String key, String requestId);

    KvResult<RaftStatusView> status(String address);
}
