package com.remediation.support;

import com.remediation.domain.model.RateLimitWindow;
import com.remediation.ratelimit.RateLimitWindowStore;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRateLimitWindowStore implements RateLimitWindowStore {

    private final Map<Long, RateLimitWindow> windows = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitWindow> load(Long runbookId) {
        return Optional.ofNullable(windows.get(runbookId)).map(InMemoryRateLimitWindowStore::copy);
    }

    @Override
    public void save(RateLimitWindow window) {
        windows.put(window.getRunbookId(), copy(window));
    }

    private static RateLimitWindow copy(RateLimitWindow window) {
        return new RateLimitWindow(
                window.getRunbookId(),
                window.getWindowStart(),
                window.getCount(),
                window.getLimit(),
                window.getWindowSeconds());
    }
}
