/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP client used to reach the nodes. Redirects are never followed so that a
 * follower's 307 reaches the router as a NOT_LEADER reply.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient nodeRestClient(RouterConfig routerConfig) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(routerConfig.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(routerConfig.getRequestTimeoutMs()));

        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader("User-Agent", "kv-router/1.0")
                .build();
    }
}
