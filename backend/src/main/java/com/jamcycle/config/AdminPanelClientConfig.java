package com.jamcycle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * RestClient used by the HTTP admin panel transport, with connect and read timeouts of
 * {@code jamcycle.admin-panel.request-timeout-seconds}.
 */
@Configuration
public class AdminPanelClientConfig {

    @Bean
    RestClient adminPanelRestClient(RestClient.Builder builder, JamCycleProperties jamCycleProperties) {
        Duration timeout = Duration.ofSeconds(Math.max(1, jamCycleProperties.getAdminPanel().getRequestTimeoutSeconds()));
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder.requestFactory(requestFactory).build();
    }
}
