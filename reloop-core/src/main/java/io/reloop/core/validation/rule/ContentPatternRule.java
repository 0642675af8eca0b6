package io.reloop.core.validation.rule;

import java.util.Objects;

/// Matches a regular expression against one of the caller-supplied text fields.
///
/// Passes iff "a match was found" equals {@link #mustMatch()}, so the same rule
/// type expresses both required and forbidden content.
///
/// @param name rule name, unique within a configuration, not null
/// @param description optional description, may be null
/// @param enabled whether the rule is evaluated
/// @param pattern regular expression source, not null
/// @param flags flag letters from `imsux`, may be null or empty
/// @param target text field to search, not null
/// @param mustMatch `true` if the pattern is required, `false` if forbidden
public record ContentPatternRule(
        String name,
        String description,
        boolean enabled,
        String pattern,
        String flags,
        ContentTarget target,
        boolean mustMatch)
        implements ValidationRule {

    public ContentPatternRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(target, "target must not be null");
        flags = flags != null ? flags : "";
    }

    @Override
    public RuleType type() {
        return RuleType.CONTENT_PATTERN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private boolean enabled = true;
        private String pattern;
        private String flags = "";
        private ContentTarget target = ContentTarget.AGENT_OUTPUT;
        private boolean mustMatch = true;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder flags(String flags) {
            this.flags = flags;
            return this;
        }

        public Builder target(ContentTarget target) {
            this.target = target;
            return this;
        }

        public Builder mustMatch(boolean mustMatch) {
            this.mustMatch = mustMatch;
            return this;
        }

        public ContentPatternRule build() {
            return new ContentPatternRule(
                    name, description, enabled, pattern, flags, target, mustMatch);
        }
    }
}
