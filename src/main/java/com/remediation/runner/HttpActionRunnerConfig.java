package com.remediation.runner;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote execution agent settings under {@code remediation.action-runner.http}.
 * The HTTP runner is only created when {@code base-url} is set.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "remediation.action-runner.http")
public class HttpActionRunnerConfig {

    private String baseUrl;

    private String executePath = "/api/v1/executions";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofMinutes(10);
}
