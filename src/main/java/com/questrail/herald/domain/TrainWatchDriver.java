package com.questrail.herald.domain;

import com.questrail.herald.api.InvalidSubscriptionException;
import com.questrail.herald.domain.train.TrainState;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persisted side of the train domain.
 *
 * <p>The only durable train state is the shortcut table; live watches are
 * driven by {@link com.questrail.herald.domain.train.WatchPoller} instead of
 * by milestones. The driver therefore never asks to be woken, and neither
 * evaluation nor catch-up changes anything.</p>
 */
public final class TrainWatchDriver implements DomainDriver<TrainState> {

    public static final String DOMAIN = "train";

    private static final Pattern CRS = Pattern.compile("[A-Za-z]{3}");

    @Override
    public String domain() {
        return DOMAIN;
    }

    @Override
    public Class<TrainState> stateType() {
        return TrainState.class;
    }

    @Override
    public TrainState initialState(Instant now) {
        return TrainState.empty();
    }

    @Override
    public CatchUpPolicy catchUpPolicy() {
        return CatchUpPolicy.DISCARD;
    }

    @Override
    public Optional<Instant> nextMilestoneAt(TrainState state, Instant now) {
        return Optional.empty();
    }

    @Override
    public DomainOutcome<TrainState> onMilestone(TrainState state, Instant now) {
        return DomainOutcome.unchanged(state);
    }

    @Override
    public DomainOutcome<TrainState> reconcile(TrainState state, Instant now) {
        return DomainOutcome.unchanged(state);
    }

    /**
     * Resolves a user-supplied station token: a saved shortcut first, then a
     * literal three-letter station code.
     *
     * @throws InvalidSubscriptionException the token is neither
     */
    public String resolveStation(TrainState state, String token) throws InvalidSubscriptionException {
        Optional<String> shortcut = state.shortcut(token);
        if (shortcut.isPresent()) {
            return shortcut.get();
        }
        String trimmed = token.trim();
        if (CRS.matcher(trimmed).matches()) {
            return trimmed.toUpperCase(Locale.ROOT);
        }
        throw new InvalidSubscriptionException("Unknown station '" + trimmed + "'");
    }

    public static boolean isStationCode(String value) {
        return value != null && CRS.matcher(value.trim()).matches();
    }
}
