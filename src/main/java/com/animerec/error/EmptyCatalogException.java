package com.animerec.error;

public class EmptyCatalogException extends RecommendationException {
    public EmptyCatalogException() {
        super("EMPTY_CATALOG", "Anime catalog is empty, nothing can be recommended");
    }
}
