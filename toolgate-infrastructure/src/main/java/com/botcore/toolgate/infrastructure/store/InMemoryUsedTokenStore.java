package com.botcore.toolgate.infrastructure.store;

import com.botcore.toolgate.application.ports.UsedTokenStore;

import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local used-token set. Lost on restart.
 */
public final class InMemoryUsedTokenStore implements UsedTokenStore {

    private final Set<String> used = ConcurrentHashMap.newKeySet();

    @Override
    public boolean contains(String token) {
        return token != null && used.contains(token);
    }

    @Override
    public boolean markUsed(String token) {
        return used.add(token);
    }

    @Override
    public int removeIf(Predicate<String> condition) {
        int removed = 0;
        Iterator<String> it = used.iterator();
        while (it.hasNext()) {
            if (condition.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return used.size();
    }
}
