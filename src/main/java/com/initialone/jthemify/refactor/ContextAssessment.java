package com.initialone.jthemify.refactor;

import com.initialone.jthemify.model.ContextAvailability;

import java.util.List;

/** Availability of the theme handle at a site, plus the reasons of the rule that decided it. */
public final class ContextAssessment {
    private final ContextAvailability availability;
    private final List<String> reasons;

    ContextAssessment(ContextAvailability availability, List<String> reasons) {
        this.availability = availability;
        this.reasons = List.copyOf(reasons);
    }

    static ContextAssessment of(ContextAvailability availability, String reason) {
        return new ContextAssessment(availability, List.of(reason));
    }

    public ContextAvailability availability() { return availability; }

    /** Ordered, most specific first */
    public List<String> reasons() { return reasons; }

    @Override
    public String toString() {
        return availability + " " + reasons;
    }
}
