package com.questrail.herald.domain;

import com.questrail.herald.api.Alert;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Result of evaluating or reconciling a domain: the state to commit and the
 * alerts to dispatch once it is committed.
 *
 * @param newState state to persist (may equal the input, meaning "no change")
 * @param alerts   alerts released after the commit, in order
 */
public record DomainOutcome<S>(S newState, List<Alert> alerts)
{
    public DomainOutcome {
        Objects.requireNonNull(newState, "newState");
        alerts = List.copyOf(alerts);
    }

    public static <S> DomainOutcome<S> unchanged(S state) {
        return new DomainOutcome<>(state, List.of());
    }

    public static <S> DomainOutcome<S> of(S newState, Alert alert) {
        return new DomainOutcome<>(newState, List.of(alert));
    }

    public static <S> DomainOutcome<S> silent(S newState) {
        return new DomainOutcome<>(newState, List.of());
    }

    /**
     * Same alerts, with {@code update} applied to the new state.
     */
    public DomainOutcome<S> mapState(UnaryOperator<S> update) {
        return new DomainOutcome<>(update.apply(newState), alerts);
    }
}
