package com.animerec.error;

public class UnknownItemException extends RecommendationException {
    private final int itemId;

    public UnknownItemException(int itemId) {
        super("UNKNOWN_ITEM", "Anime " + itemId + " is not in the catalog");
        this.itemId = itemId;
    }

    public int itemId() {
        return itemId;
    }
}
