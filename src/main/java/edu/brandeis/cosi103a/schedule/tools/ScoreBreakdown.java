package edu.brandeis.cosi103a.schedule.tools;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Weighted score of one path, with one line per active metric.
 */
public record ScoreBreakdown(double total, ImmutableList<Line> lines) {

    public record Line(PainMetric metric, double weight, double raw, String details) {

        public double weighted() {
            return weight * raw;
        }
    }

    /** Metric lines as shown in reports, names padded to a common width. */
    public String format() {
        int width = lines.stream().mapToInt(line -> line.metric().key().length()).max().orElse(0);
        return lines.stream()
            .map(line -> String.format(Locale.ROOT, "%s: %5.2f (%s * %.1f) %s",
                Strings.padEnd(line.metric().key(), width, ' '),
                line.weighted(),
                BigDecimal.valueOf(line.weight()).stripTrailingZeros().toPlainString(),
                line.raw(),
                line.details()))
            .collect(Collectors.joining(System.lineSeparator()));
    }
}
