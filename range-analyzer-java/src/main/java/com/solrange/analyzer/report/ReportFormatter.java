package com.solrange.analyzer.report;

import com.solrange.analyzer.range.NarrowingStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text rendering of bounds reports, one line per report plus one indented line per
 * narrowing step.
 */
public class ReportFormatter {

    private final boolean showSteps;

    public ReportFormatter(boolean showSteps) {
        this.showSteps = showSteps;
    }

    public List<String> lines(List<BoundsReport> reports) {
        List<String> out = new ArrayList<>();
        String lastContext = null;
        for (BoundsReport r : reports) {
            if (!r.contextPath().equals(lastContext)) {
                out.add(r.contextPath() + ":");
                lastContext = r.contextPath();
            }
            out.add("  " + line(r));
            if (showSteps) {
                for (NarrowingStep step : r.steps()) {
                    out.add("      " + step.describe());
                }
            }
        }
        return out;
    }

    public String format(List<BoundsReport> reports) {
        return String.join(System.lineSeparator(), lines(reports));
    }

    private String line(BoundsReport r) {
        StringBuilder sb = new StringBuilder();
        sb.append(r.variable()).append(" : ").append(r.type());
        if (r.range() != null) {
            sb.append(" = ").append(r.range().describe());
            if (r.range().overflow()) sb.append(" (may overflow)");
            if (r.range().underflow()) sb.append(" (may underflow)");
            if (r.range().divisionByZero()) sb.append(" (may divide by zero)");
        } else {
            sb.append(" = ").append(r.derivation());
        }
        if (r.initialRange() != null && !r.initialRange().sameBounds(r.range())) {
            sb.append("  from ").append(r.initialRange().describe());
        }
        return sb.toString();
    }
}
