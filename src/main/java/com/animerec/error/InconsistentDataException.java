package com.animerec.error;

import com.animerec.domain.DomainModels.DataIssue;

import java.util.List;
import java.util.stream.Collectors;

public class InconsistentDataException extends RecommendationException {
    private final List<DataIssue> issues;

    public InconsistentDataException(List<DataIssue> issues) {
        super("INCONSISTENT_DATA", describe(issues));
        this.issues = List.copyOf(issues);
    }

    public InconsistentDataException(DataIssue issue) {
        this(List.of(issue));
    }

    public List<DataIssue> issues() {
        return issues;
    }

    private static String describe(List<DataIssue> issues) {
        String head = issues.stream().limit(5).map(i -> i.code() + ": " + i.message()).collect(Collectors.joining("; "));
        return issues.size() > 5 ? head + " (+" + (issues.size() - 5) + " more)" : head;
    }
}
