package io.reloop.core.validation.preset;

import io.reloop.core.exception.InvalidIterationConfigException;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.ContentTarget;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CoverageScope;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Global rules plus per-agent {@link RulePreset}s merged into a session's rules.
///
/// ### Merge Order
/// 1. global rules
/// 2. the agent's preset rules, replacing global rules of the same name
/// 3. the session's own rules, replacing earlier rules of the same name
///
/// Replaced rules keep their position, so a session can switch off a preset rule by
/// sending a disabled rule with its name.
///
/// @implNote Thread-safe. Immutable.
public final class RulePresetCatalog {

    private final List<ValidationRule> globalRules;
    private final Map<String, RulePreset> presets;

    public RulePresetCatalog(List<ValidationRule> globalRules, List<RulePreset> presets) {
        this.globalRules =
                List.copyOf(Objects.requireNonNull(globalRules, "globalRules must not be null"));
        Map<String, RulePreset> byAgent = new LinkedHashMap<>();
        for (RulePreset preset : Objects.requireNonNull(presets, "presets must not be null")) {
            if (byAgent.put(preset.agentId(), preset) != null) {
                throw new IllegalArgumentException("Duplicate rule preset: " + preset.agentId());
            }
        }
        this.presets = Map.copyOf(byAgent);
    }

    /// Returns a catalog with no global rules and no presets.
    public static RulePresetCatalog empty() {
        return new RulePresetCatalog(List.of(), List.of());
    }

    /// Returns the built-in catalog: no global rules and presets for the agent roles
    /// `qa`, `me`, `sec`, `do`, `doc`, `ta` and `uid`.
    ///
    /// @return the built-in catalog, never null
    public static RulePresetCatalog defaults() {
        return new RulePresetCatalog(
                List.of(),
                List.of(
                        new RulePreset(
                                "qa",
                                List.of(
                                        command("tests_pass", "All tests must pass", "npm test", 120),
                                        CoverageRule.builder()
                                                .name("coverage_threshold")
                                                .description("Minimum 80% line coverage")
                                                .reportPath("coverage/lcov.info")
                                                .reportFormat(CoverageFormat.LCOV)
                                                .minCoverage(80)
                                                .scope(CoverageScope.LINES)
                                                .build(),
                                        ContentPatternRule.builder()
                                                .name("promise_complete")
                                                .description("Check for completion promise in output")
                                                .pattern("<promise>COMPLETE</promise>")
                                                .enabled(false)
                                                .build())),
                        new RulePreset(
                                "me",
                                List.of(
                                        command(
                                                "build_succeeds",
                                                "Project builds successfully",
                                                "npm run build",
                                                180),
                                        command("lint_passes", "Code passes linting", "npm run lint", 60))),
                        new RulePreset(
                                "sec",
                                List.of(
                                        command(
                                                "security_scan",
                                                "Security scan passes",
                                                "npm audit --audit-level=moderate",
                                                90),
                                        ContentPatternRule.builder()
                                                .name("no_hardcoded_secrets")
                                                .description("No hardcoded secrets detected")
                                                .pattern(
                                                        "(password|secret|api[_-]?key)\\s*=\\s*[\"'][^\"']+[\"']")
                                                .flags("i")
                                                .target(ContentTarget.WORK_PRODUCT_LATEST)
                                                .mustMatch(false)
                                                .build())),
                        new RulePreset(
                                "do",
                                List.of(
                                        CommandRule.builder()
                                                .name("docker_build")
                                                .description("Docker image builds successfully")
                                                .command("docker build -t test-image .")
                                                .timeout(Duration.ofMinutes(5))
                                                .enabled(false)
                                                .build(),
                                        new FileExistenceRule(
                                                "config_files_exist",
                                                "Required configuration files exist",
                                                true,
                                                List.of(".github/workflows/ci.yml", "Dockerfile"),
                                                false))),
                        new RulePreset(
                                "doc",
                                List.of(
                                        workProductPattern(
                                                "has_code_examples",
                                                "Documentation includes code examples",
                                                "```[\\s\\S]*?```",
                                                null),
                                        workProductPattern(
                                                "has_headings",
                                                "Documentation has proper structure",
                                                "^#{1,3}\\s+.+$",
                                                "m"),
                                        new FileExistenceRule(
                                                "readme_exists",
                                                "README file exists",
                                                false,
                                                List.of("README.md"),
                                                true))),
                        new RulePreset(
                                "ta",
                                List.of(
                                        workProductPattern(
                                                "has_architecture_diagram",
                                                "Architecture includes diagrams",
                                                "```mermaid[\\s\\S]*?```",
                                                null),
                                        workProductPattern(
                                                "has_decision_records",
                                                "Architecture documents decisions",
                                                "(decision|rationale|trade-off)",
                                                "i"))),
                        new RulePreset(
                                "uid",
                                List.of(
                                        command(
                                                "ui_tests_pass",
                                                "UI tests pass",
                                                "npm run test:ui",
                                                120)))));
    }

    public List<ValidationRule> getGlobalRules() {
        return globalRules;
    }

    public Optional<RulePreset> find(String agentId) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        return Optional.ofNullable(presets.get(agentId));
    }

    public Set<String> agentIds() {
        return presets.keySet();
    }

    /// Returns `config` with its rules merged over the global and agent rules.
    ///
    /// @param taskId the task the config is for, not null
    /// @param agentId the agent role, or null for global rules only
    /// @param config the session config, not null
    /// @return the merged config, `config` itself when there is nothing to merge
    /// @throws InvalidIterationConfigException if `agentId` has no preset
    public IterationConfig apply(String taskId, String agentId, IterationConfig config) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(config, "config must not be null");

        List<ValidationRule> base = new ArrayList<>(globalRules);
        if (agentId != null) {
            RulePreset preset = presets.get(agentId);
            if (preset == null) {
                throw new InvalidIterationConfigException(
                        taskId, List.of("agentId has no rule preset: " + agentId));
            }
            overlay(base, preset.rules());
        }
        if (base.isEmpty()) {
            return config;
        }
        overlay(base, config.getValidationRules());
        return config.toBuilder().validationRules(base).build();
    }

    private static void overlay(List<ValidationRule> base, List<ValidationRule> overrides) {
        for (ValidationRule rule : overrides) {
            int index = indexOf(base, rule.name());
            if (index >= 0) {
                base.set(index, rule);
            } else {
                base.add(rule);
            }
        }
    }

    private static int indexOf(List<ValidationRule> rules, String name) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static CommandRule command(
            String name, String description, String command, long timeoutSeconds) {
        return CommandRule.builder()
                .name(name)
                .description(description)
                .command(command)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    private static ContentPatternRule workProductPattern(
            String name, String description, String pattern, String flags) {
        return ContentPatternRule.builder()
                .name(name)
                .description(description)
                .pattern(pattern)
                .flags(flags)
                .target(ContentTarget.WORK_PRODUCT_LATEST)
                .build();
    }
}
