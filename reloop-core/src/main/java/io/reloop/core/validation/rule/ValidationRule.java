package io.reloop.core.validation.rule;

/// Sealed interface for declarative validation rules.
///
/// A rule names one machine-verifiable condition that is checked once per
/// iteration by the {@link io.reloop.core.validation.ValidationEngine}. Every rule
/// carries a name that is unique within its {@link io.reloop.core.iteration.IterationConfig}
/// and an `enabled` flag; disabled rules are skipped and excluded from all counts.
///
/// ### Permitted Implementations
/// - {@link CommandRule} - shell command exit code
/// - {@link ContentPatternRule} - regex match against caller-supplied text
/// - {@link CoverageRule} - coverage report threshold
/// - {@link FileExistenceRule} - presence of files in the working tree
/// - {@link CustomRule} - dispatch to a registered custom validator
///
/// @implNote Implementations are immutable records and safe to share across threads.
///
/// @see RuleType for the wire discriminator of each implementation
public sealed interface ValidationRule
        permits CommandRule, ContentPatternRule, CoverageRule, FileExistenceRule, CustomRule {

    /// Returns the rule name, unique within a configuration.
    ///
    /// @return the rule name, never null
    String name();

    /// Returns the optional human-readable description.
    ///
    /// @return the description, may be null
    String description();

    /// Returns whether this rule takes part in validation.
    ///
    /// @return `true` if the rule is evaluated
    boolean enabled();

    /// Returns the discriminator for this rule.
    ///
    /// @return the rule type, never null
    RuleType type();
}
