package com.remediation.matching;

import com.remediation.domain.model.Alert;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.Trigger;
import com.remediation.event.EventPublisherHelper;
import com.remediation.exception.TriggerConfigurationException;
import com.remediation.repository.TriggerCatalog;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds the triggers an alert satisfies and resolves their runbooks.
 *
 * <p>Candidates are ordered by trigger priority (descending), then trigger id (ascending), so the
 * result is deterministic for a given configuration. When several triggers point at the same
 * runbook only the first in that order is kept: one alert never runs a runbook twice.
 *
 * <p>Broken definitions (invalid pattern, missing or disabled runbook) are reported through a
 * {@link com.remediation.event.TriggerConfigurationEvent} and skipped; the remaining triggers are
 * still evaluated. No match at all is the normal case and yields an empty list.
 */
@Service
public class TriggerMatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerMatcher.class);

    static final Comparator<Trigger> CANDIDATE_ORDER = Comparator.comparingInt(Trigger::getPriority)
            .reversed()
            .thenComparing(Trigger::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TriggerCatalog triggerCatalog;
    private final PatternMatcher patternMatcher;
    private final EventPublisherHelper eventPublisherHelper;

    public TriggerMatcher(
            TriggerCatalog triggerCatalog, PatternMatcher patternMatcher, EventPublisherHelper eventPublisherHelper) {
        this.triggerCatalog = triggerCatalog;
        this.patternMatcher = patternMatcher;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Evaluates the alert against every enabled trigger.
     *
     * @return matched (trigger, runbook) pairs in admission order; empty when nothing matches
     */
    public List<TriggerCandidate> findCandidates(Alert alert) {
        List<MatchedTrigger> matched = new ArrayList<>();
        for (Trigger trigger : triggerCatalog.listEnabledTriggers()) {
            if (!trigger.isEnabled()) {
                continue;
            }
            try {
                patternMatcher
                        .match(alert, trigger)
                        .ifPresent(variables -> matched.add(new MatchedTrigger(trigger, variables)));
            } catch (TriggerConfigurationException e) {
                reportConfigurationError(trigger, alert, e.getMessage());
            }
        }
        matched.sort(Comparator.comparing(MatchedTrigger::trigger, CANDIDATE_ORDER));

        List<TriggerCandidate> candidates = new ArrayList<>();
        Set<Long> seenRunbooks = new HashSet<>();
        for (MatchedTrigger match : matched) {
            Trigger trigger = match.trigger();
            if (seenRunbooks.contains(trigger.getRunbookId())) {
                log.debug(
                        "Trigger {} skipped for alert {}: runbook {} already matched by a higher-priority trigger",
                        trigger.getId(),
                        alert.getId(),
                        trigger.getRunbookId());
                continue;
            }

            Optional<Runbook> runbook = resolveRunbook(trigger, alert);
            if (runbook.isPresent()) {
                seenRunbooks.add(trigger.getRunbookId());
                candidates.add(new TriggerCandidate(trigger, runbook.get(), match.variables()));
            }
        }

        if (candidates.isEmpty()) {
            log.debug("No trigger matched alert {} ({})", alert.getId(), alert.getName());
        } else {
            log.info(
                    "Alert {} ({}) matched {} trigger(s): {}",
                    alert.getId(),
                    alert.getName(),
                    candidates.size(),
                    candidates.stream().map(c -> c.trigger().getId()).toList());
        }
        return candidates;
    }

    private Optional<Runbook> resolveRunbook(Trigger trigger, Alert alert) {
        if (trigger.getRunbookId() == null) {
            reportConfigurationError(trigger, alert, "Trigger " + trigger.getId() + " has no runbook");
            return Optional.empty();
        }

        Optional<Runbook> runbook = triggerCatalog.getRunbook(trigger.getRunbookId());
        if (runbook.isEmpty()) {
            reportConfigurationError(
                    trigger, alert, "Trigger " + trigger.getId() + " references missing runbook " + trigger.getRunbookId());
            return Optional.empty();
        }
        if (!runbook.get().isEnabled()) {
            reportConfigurationError(
                    trigger, alert, "Trigger " + trigger.getId() + " references disabled runbook " + trigger.getRunbookId());
            return Optional.empty();
        }
        return runbook;
    }

    private record MatchedTrigger(Trigger trigger, Map<String, String> variables) {}

    private void reportConfigurationError(Trigger trigger, Alert alert, String message) {
        log.warn("Skipping trigger {} for alert {}: {}", trigger.getId(), alert.getId(), message);
        eventPublisherHelper.publishTriggerConfigurationError(this, trigger.getId(), alert.getId(), message);
    }
}
