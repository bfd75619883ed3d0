package org.netpreserve.domainprober.fetch;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Picks a User-Agent at random for each request.
 */
public class UserAgents implements Supplier<String> {
    private final List<String> userAgents;

    public UserAgents(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one User-Agent is required");
        }
        this.userAgents = List.copyOf(userAgents);
    }

    @Override
    public String get() {
        if (userAgents.size() == 1) return userAgents.get(0);
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
