package com.animerec.recommendation;

import com.animerec.domain.DomainModels.UserProfile;

/**
 * Share of the collaborative component in a hybrid score for one user; always within [0,1].
 */
@FunctionalInterface
public interface BlendWeightFunction {
    double alpha(UserProfile profile);
}
