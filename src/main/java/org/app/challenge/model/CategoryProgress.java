package org.app.challenge.model;

import java.util.List;

/**
 * Progress within one OWASP category.
 * - covered: the category has active scenarios and every one of them is solved
 */
public record CategoryProgress(String code, String title, int total, int active, int solved, int suspect,
                               boolean covered, List<String> solvedScenarios, List<String> suspectScenarios) {
}
