/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One node's entry in the router status report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeHealth(
        String id,
        String address,
        boolean reachable,
        String state,
        Long term,
        String error
) {

    static NodeHealth from(NodeProbe probe) {
        var node = probe.node();
        if (probe.reachable()) {
            var status = probe.status().getValue();
            return new NodeHealth(node.id(), node.address(), true, status.state(), status.term(), null);
        }
        return new NodeHealth(node.id(), node.address(), false, null, null, probe.status().getError().message());
    }
}
