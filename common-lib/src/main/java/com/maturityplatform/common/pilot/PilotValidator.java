package com.maturityplatform.common.pilot;

import com.maturityplatform.common.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural completeness gate a pilot design must pass before approval.
 *
 * <h3>Gate conditions (all required)</h3>
 * <ol>
 *   <li>At least {@value #MIN_SUCCESS_CRITERIA} success criteria, each with a metric
 *       name, a finite numeric target and a measurement method.</li>
 *   <li>At least {@value #MIN_FAILURE_MODES} failure mode, each with a description
 *       and a mitigation action.</li>
 *   <li>A non-empty stakeholder map.</li>
 * </ol>
 *
 * <p>Pure predicate. Never mutates the pilot.
 */
public final class PilotValidator {

    public static final int MIN_SUCCESS_CRITERIA = 3;
    public static final int MIN_FAILURE_MODES = 1;

    public PilotValidationReport validate(PilotDesign design) {
        List<String> violations = new ArrayList<>();
        if (design == null) {
            return new PilotValidationReport(List.of("Pilot design is missing"));
        }

        List<SuccessCriterion> criteria = design.successCriteria();
        if (criteria.size() < MIN_SUCCESS_CRITERIA) {
            violations.add("At least " + MIN_SUCCESS_CRITERIA + " success criteria required, got " + criteria.size());
        }
        for (int i = 0; i < criteria.size(); i++) {
            SuccessCriterion c = criteria.get(i);
            if (isBlank(c.metricName())) {
                violations.add("Success criterion #" + (i + 1) + " has no metric name");
            }
            if (c.targetValue() == null || c.targetValue().isNaN() || c.targetValue().isInfinite()) {
                violations.add("Success criterion #" + (i + 1) + " has no numeric target");
            }
            if (isBlank(c.measurementMethod())) {
                violations.add("Success criterion #" + (i + 1) + " has no measurement method");
            }
        }

        List<FailureMode> failureModes = design.failureModes();
        if (failureModes.size() < MIN_FAILURE_MODES) {
            violations.add("At least " + MIN_FAILURE_MODES + " failure mode required, got " + failureModes.size());
        }
        for (int i = 0; i < failureModes.size(); i++) {
            FailureMode f = failureModes.get(i);
            if (isBlank(f.description())) {
                violations.add("Failure mode #" + (i + 1) + " has no description");
            }
            if (isBlank(f.mitigation())) {
                violations.add("Failure mode #" + (i + 1) + " has no mitigation action");
            }
        }

        if (design.stakeholders().isEmpty()) {
            violations.add("Stakeholder map is empty");
        }
        return new PilotValidationReport(violations);
    }

    /**
     * @throws ValidationException naming every failed condition
     */
    public void requireValid(PilotDesign design) {
        PilotValidationReport report = validate(design);
        if (!report.valid()) {
            throw new ValidationException("Pilot design fails the approval gate", report.violations());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
