package io.reloop.core.validation.coverage;

import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.rule.CoverageScope;

/// Parses LCOV tracefiles (`lcov.info`).
///
/// Sums the found/hit counters of every record for the requested scope:
///
/// | Scope                   | Found | Hit   |
/// |-------------------------|-------|-------|
/// | lines, statements       | `LF`  | `LH`  |
/// | branches                | `BRF` | `BRH` |
/// | functions               | `FNF` | `FNH` |
///
/// LCOV has no statement counters; line counters stand in for them.
public final class LcovReportParser implements CoverageReportParser {

    @Override
    public double percentage(String content, CoverageScope scope) throws EvaluatorException {
        String foundKey;
        String hitKey;
        switch (scope) {
            case BRANCHES -> {
                foundKey = "BRF:";
                hitKey = "BRH:";
            }
            case FUNCTIONS -> {
                foundKey = "FNF:";
                hitKey = "FNH:";
            }
            default -> {
                foundKey = "LF:";
                hitKey = "LH:";
            }
        }

        long found = 0;
        long hit = 0;
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.startsWith(foundKey)) {
                found += parseCounter(line, foundKey);
            } else if (line.startsWith(hitKey)) {
                hit += parseCounter(line, hitKey);
            }
        }

        if (found == 0) {
            throw new EvaluatorException(
                    "LCOV report has no " + scope.wireName() + " data (" + foundKey + " 0)");
        }
        return 100.0 * hit / found;
    }

    private static long parseCounter(String line, String key) throws EvaluatorException {
        try {
            return Long.parseLong(line.substring(key.length()).trim());
        } catch (NumberFormatException e) {
            throw new EvaluatorException("Malformed LCOV counter: " + line, e);
        }
    }
}
