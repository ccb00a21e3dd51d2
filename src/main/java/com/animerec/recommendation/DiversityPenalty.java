package com.animerec.recommendation;

import java.util.List;

/**
 * Redundancy of a candidate with respect to items already picked, within [0,1].
 */
@FunctionalInterface
public interface DiversityPenalty {
    double penalty(int candidateId, List<Integer> selectedIds);
}
