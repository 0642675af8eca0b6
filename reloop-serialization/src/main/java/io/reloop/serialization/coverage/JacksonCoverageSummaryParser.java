package io.reloop.serialization.coverage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reloop.core.validation.coverage.CoverageReportParser;
import io.reloop.core.validation.evaluator.EvaluatorException;
import io.reloop.core.validation.rule.CoverageScope;

/// Parses Istanbul `json-summary` reports (`coverage-summary.json`).
///
/// Reads `total.<scope>.pct`, for example:
/// {@snippet lang=json :
/// { "total": { "lines": { "total": 120, "covered": 96, "pct": 80 } } }
/// }
///
/// When `pct` is absent but `total` and `covered` are present, the percentage is
/// computed from them.
///
/// @implNote Thread-safe. The shared mapper is only used for reading trees.
public final class JacksonCoverageSummaryParser implements CoverageReportParser {

    private final ObjectMapper mapper;

    public JacksonCoverageSummaryParser() {
        this(new ObjectMapper());
    }

    public JacksonCoverageSummaryParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public double percentage(String content, CoverageScope scope) throws EvaluatorException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new EvaluatorException(
                    "Malformed JSON coverage summary: " + e.getOriginalMessage(), e);
        }

        JsonNode metric = root == null ? null : root.path("total").path(scope.wireName());
        if (metric == null || !metric.isObject()) {
            throw new EvaluatorException(
                    "JSON coverage summary has no total." + scope.wireName() + " metric");
        }

        JsonNode pct = metric.get("pct");
        if (pct != null && pct.isNumber()) {
            return pct.asDouble();
        }

        JsonNode total = metric.get("total");
        JsonNode covered = metric.get("covered");
        if (total == null || covered == null || !total.isNumber() || !covered.isNumber()) {
            throw new EvaluatorException(
                    "JSON coverage summary metric total." + scope.wireName() + " has no pct");
        }
        if (total.asLong() == 0) {
            // Istanbul reports 100% for empty scopes
            return 100.0;
        }
        return 100.0 * covered.asLong() / total.asLong();
    }
}
