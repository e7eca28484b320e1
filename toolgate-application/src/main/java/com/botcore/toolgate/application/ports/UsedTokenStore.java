package com.botcore.toolgate.application.ports;

import java.util.function.Predicate;

/**
 * Set of confirmation tokens that were already consumed.
 * Implementations must make {@link #markUsed(String)} atomic.
 */
public interface UsedTokenStore {

    boolean contains(String token);

    /** @return true if the token was not present and is now recorded, false if someone consumed it first */
    boolean markUsed(String token);

    /** @return number of removed entries */
    int removeIf(Predicate<String> condition);

    int size();
}
