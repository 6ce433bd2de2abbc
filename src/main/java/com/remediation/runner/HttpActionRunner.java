package com.remediation.runner;

import com.remediation.domain.model.ActionResult;
import com.remediation.domain.model.ExecutionTarget;
import com.remediation.domain.model.Runbook;
import com.remediation.exception.ActionTransportException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link ActionRunner} delegating to a remote execution agent over HTTP.
 *
 * <p>POSTs the action definition and target to {@code baseUrl + executePath} and waits for the
 * agent's verdict. A 2xx answer carries the result; anything else, or no answer at all, means the
 * action could not be run and surfaces as {@link ActionTransportException}.
 */
public class HttpActionRunner implements ActionRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpActionRunner.class);

    private final RestClient restClient;
    private final HttpActionRunnerConfig config;

    public HttpActionRunner(RestClient.Builder restClientBuilder, HttpActionRunnerConfig config) {
        this.restClient = restClientBuilder.baseUrl(config.getBaseUrl()).build();
        this.config = config;
    }

    @Override
    public ActionResult execute(Runbook runbook, ExecutionTarget target) {
        ActionRequest request = new ActionRequest(
                target.getExecutionId(),
                runbook.getId(),
                runbook.getName(),
                runbook.getActionDefinition(),
                target.getScopeType(),
                target.getScopeId(),
                target.getVariables() != null ? target.getVariables() : Map.of(),
                runbook.getTimeoutSeconds());

        log.debug("Dispatching execution {} to agent at {}", target.getExecutionId(), config.getBaseUrl());

        ActionResponse response;
        try {
            response = restClient
                    .post()
                    .uri(config.getExecutePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(ActionResponse.class);
        } catch (RestClientResponseException e) {
            throw new ActionTransportException(
                    "Agent answered " + e.getStatusCode().value() + " for execution " + target.getExecutionId(), e);
        } catch (ResourceAccessException e) {
            throw new ActionTransportException("Agent unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ActionTransportException("Agent call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ActionTransportException("Agent returned no body for execution " + target.getExecutionId());
        }
        return response.success() ? ActionResult.success(response.detail()) : ActionResult.failure(response.detail());
    }

    record ActionRequest(
            String executionId,
            Long runbookId,
            String runbookName,
            String action,
            String scopeType,
            String scopeId,
            Map<String, String> variables,
            Integer timeoutSeconds) {}

    record ActionResponse(boolean success, String detail) {}
}
