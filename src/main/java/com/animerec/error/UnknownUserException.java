package com.animerec.error;

public class UnknownUserException extends RecommendationException {
    private final int userId;

    public UnknownUserException(int userId) {
        super("UNKNOWN_USER", "User " + userId + " has no ratings and popularity fallback is disabled");
        this.userId = userId;
    }

    public int userId() {
        return userId;
    }
}
