package com.animerec.data;

import com.animerec.store.AnimeCatalog;
import com.animerec.store.RatingStore;

public record Dataset(RatingStore ratings, AnimeCatalog catalog) {}
