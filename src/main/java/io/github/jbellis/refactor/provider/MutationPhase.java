package io.github.jbellis.refactor.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of a rename or extract. Files are touched only from {@link #BACKING_UP} on, and a failure while
 * {@link #APPLYING} always ends in {@link #ROLLED_BACK}.
 */
public enum MutationPhase {
    IDLE,
    RESOLVING,
    CONFLICT_CHECK,
    PLANNING,
    BACKING_UP,
    APPLYING,
    COMMITTED,
    ROLLED_BACK;

    private static final Logger logger = LogManager.getLogger(MutationPhase.class);

    public boolean touchesFiles() {
        return this == BACKING_UP || this == APPLYING;
    }

    Set<MutationPhase> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(RESOLVING);
            case RESOLVING -> EnumSet.of(CONFLICT_CHECK);
            case CONFLICT_CHECK -> EnumSet.of(PLANNING);
            case PLANNING -> EnumSet.of(BACKING_UP);
            case BACKING_UP -> EnumSet.of(APPLYING);
            case APPLYING -> EnumSet.of(COMMITTED, ROLLED_BACK);
            case COMMITTED, ROLLED_BACK -> EnumSet.noneOf(MutationPhase.class);
        };
    }

    /**
     * Tracks the phase of one operation and logs each transition.
     */
    static final class Tracker {
        private final String operation;
        private MutationPhase phase = IDLE;

        Tracker(String operation) {
            this.operation = operation;
        }

        MutationPhase phase() {
            return phase;
        }

        void advance(MutationPhase next) {
            if (!phase.successors().contains(next)) {
                throw new IllegalStateException(operation + ": cannot move from " + phase + " to " + next);
            }
            logger.debug("{}: {} -> {}", operation, phase, next);
            phase = next;
        }
    }
}
