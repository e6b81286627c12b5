package com.questrail.callwatch.api;

/**
 * Handle returned by subscription methods.
 */
@FunctionalInterface
public interface Subscription
{
    /**
     * Stops delivery to the subscribed handler. Calling this more than once has
     * no further effect.
     */
    void unsubscribe();
}
