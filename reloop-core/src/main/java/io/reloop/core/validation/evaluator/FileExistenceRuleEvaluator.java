package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.FileExistenceRule;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Evaluates {@link FileExistenceRule}s relative to the working directory.
public final class FileExistenceRuleEvaluator implements RuleEvaluator<FileExistenceRule> {

    @Override
    public RuleOutcome evaluate(FileExistenceRule rule, ValidationContext context)
            throws EvaluatorException {
        if (rule.paths().isEmpty()) {
            throw new EvaluatorException("No paths configured");
        }

        List<String> existing = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String path : rule.paths()) {
            if (Files.exists(context.workingDirectory().resolve(path))) {
                existing.add(path);
            } else {
                missing.add(path);
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("existing", existing);
        details.put("missing", missing);

        boolean passed = rule.allMustExist() ? missing.isEmpty() : !existing.isEmpty();
        if (passed) {
            return RuleOutcome.pass(
                    existing.size() + " of " + rule.paths().size() + " file(s) present", details);
        }
        return RuleOutcome.fail(
                rule.allMustExist()
                        ? "Missing file(s): " + String.join(", ", missing)
                        : "None of the expected files exist: " + String.join(", ", missing),
                details);
    }
}
