package com.animerec.error;

/**
 * Content similarity needs at least one seed item; this is the "cannot personalize" case for it.
 */
public class EmptySeedException extends RecommendationException {
    public EmptySeedException() {
        super("EMPTY_SEED", "No seed anime supplied for content similarity");
    }

    public EmptySeedException(int userId) {
        super("EMPTY_SEED", "User " + userId + " has no rated anime to seed content similarity");
    }
}
