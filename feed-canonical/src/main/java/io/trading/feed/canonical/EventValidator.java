package io.trading.feed.canonical;

import io.trading.feed.canonical.model.CanonicalEvent;

import java.util.Optional;

/**
 * Extension point for semantic checks on canonical events before dispatch (price bands,
 * crossed books, and the like).
 *
 * <p>A rejected event goes to the error path and is never dispatched.
 */
@FunctionalInterface
public interface EventValidator {

    /**
     * @return empty to accept the event, otherwise the rejection reason
     */
    Optional<String> validate(CanonicalEvent event);

    static EventValidator acceptAll() {
        return event -> Optional.empty();
    }
}
