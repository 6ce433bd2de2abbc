package com.remediation.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.Trigger;
import com.remediation.exception.TriggerConfigurationException;
import java.time.DateTimeException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.stereotype.Component;

/**
 * Decides whether a single trigger's predicate accepts an alert.
 *
 * <p>Every configured constraint must hold; unconstrained attributes are wildcards, so a trigger
 * with no constraints matches every alert. Guarding against such broad triggers is left to
 * trigger priority, not to this class.
 *
 * <p>Compiled patterns are kept in a Caffeine cache keyed by flags and expression, so a trigger's
 * glob or regex is compiled once rather than on every alert. Thread-safe.
 */
@Component
public class PatternMatcher {

    private static final int CACHE_SIZE = 1000;

    /** Caffeine cache: key = "flags|regex", value = compiled Pattern, 1h idle expiry. */
    private final Cache<String, Pattern> patternCache;

    public PatternMatcher() {
        this.patternCache = Caffeine.newBuilder()
                .maximumSize(CACHE_SIZE)
                .expireAfterAccess(1, TimeUnit.HOURS)
                .build();
    }

    /**
     * @throws TriggerConfigurationException if a constraint is malformed (bad regex, unknown zone)
     */
    public boolean matches(Alert alert, Trigger trigger) {
        return match(alert, trigger).isPresent();
    }

    /**
     * Evaluates the trigger and collects the variables its constraints captured.
     *
     * @return the captured variables (possibly empty) when the trigger matches; empty otherwise
     * @throws TriggerConfigurationException if a constraint is malformed (bad regex, unknown zone)
     */
    public Optional<Map<String, String>> match(Alert alert, Trigger trigger) {
        List<TriggerConstraint> constraints = trigger.getConstraints();
        if (constraints == null || constraints.isEmpty()) {
            return Optional.of(Map.of());
        }

        MatchContext context = new MatchContext(this);
        for (TriggerConstraint constraint : constraints) {
            try {
                if (!constraint.isSatisfiedBy(alert, context)) {
                    return Optional.empty();
                }
            } catch (PatternSyntaxException e) {
                throw new TriggerConfigurationException(
                        trigger.getId(), "Invalid pattern in trigger " + trigger.getId() + ": " + e.getDescription());
            } catch (DateTimeException e) {
                throw new TriggerConfigurationException(
                        trigger.getId(), "Invalid time window in trigger " + trigger.getId() + ": " + e.getMessage());
            }
        }
        return Optional.of(context.variables());
    }

    /**
     * Returns the cached compiled form of {@code regex}, compiling it on first use.
     *
     * @throws PatternSyntaxException if the expression is invalid; invalid expressions are not cached
     */
    public Pattern compile(String regex, int flags) {
        return patternCache.get(flags + "|" + regex, key -> Pattern.compile(regex, flags));
    }
}
