package com.gnovoa.publeague.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates constraint violations for one generation run. Callers inspect it before committing
 * a season; nothing in here is ever thrown.
 */
public final class ViolationReport {

    private final List<Violation> violations = new ArrayList<>();

    public ViolationReport add(ConstraintCode code, Integer weekNumber, String message) {
        violations.add(new Violation(code, weekNumber, message));
        return this;
    }

    public ViolationReport merge(ViolationReport other) {
        violations.addAll(other.violations);
        return this;
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }

    public List<Violation> hardViolations() {
        return violations.stream().filter(v -> !v.advisory()).toList();
    }

    public List<Violation> advisoryViolations() {
        return violations.stream().filter(Violation::advisory).toList();
    }

    public boolean has(ConstraintCode code) {
        return violations.stream().anyMatch(v -> v.code() == code);
    }

    public Set<ConstraintCode> codes() {
        Set<ConstraintCode> codes = EnumSet.noneOf(ConstraintCode.class);
        violations.forEach(v -> codes.add(v.code()));
        return codes;
    }

    /** True when no hard constraint failed. Advisory findings do not count. */
    public boolean isAcceptable() {
        return hardViolations().isEmpty();
    }

    public boolean isEmpty() {
        return violations.isEmpty();
    }

    public List<String> messages() {
        return violations.stream().map(Violation::toString).toList();
    }
}
