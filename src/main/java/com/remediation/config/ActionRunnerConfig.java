package com.remediation.config;

import com.remediation.runner.ActionRunner;
import com.remediation.runner.HttpActionRunner;
import com.remediation.runner.HttpActionRunnerConfig;
import com.remediation.runner.UnconfiguredActionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Chooses the {@link ActionRunner}: the HTTP agent client when
 * {@code remediation.action-runner.http.base-url} is set, otherwise a runner that fails every
 * dispatch.
 */
@Configuration
@EnableConfigurationProperties(HttpActionRunnerConfig.class)
public class ActionRunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(ActionRunnerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "remediation.action-runner.http", name = "base-url")
    public ActionRunner httpActionRunner(RestClient.Builder restClientBuilder, HttpActionRunnerConfig config) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(config.getConnectTimeout());
        requestFactory.setReadTimeout(config.getReadTimeout());

        log.info("Action runner: HTTP agent at {}", config.getBaseUrl());
        return new HttpActionRunner(restClientBuilder.clone().requestFactory(requestFactory), config);
    }

    @Bean
    @ConditionalOnMissingBean(ActionRunner.class)
    public ActionRunner unconfiguredActionRunner() {
        log.warn("No action runner configured; every dispatched execution will fail with a transport error");
        return new UnconfiguredActionRunner();
    }
}
