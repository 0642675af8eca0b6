package io.reloop.core.validation.evaluator;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Compiles rule patterns with letter flags into {@link Pattern}s.
///
/// | Flag | Meaning                        |
/// |------|--------------------------------|
/// | `i`  | {@link Pattern#CASE_INSENSITIVE} |
/// | `m`  | {@link Pattern#MULTILINE}      |
/// | `s`  | {@link Pattern#DOTALL}         |
/// | `u`  | {@link Pattern#UNICODE_CASE}   |
/// | `x`  | {@link Pattern#COMMENTS}       |
///
/// `g` is accepted and ignored since evaluators always scan the whole text.
public final class PatternCompiler {

    private PatternCompiler() {}

    /// Compiles a pattern.
    ///
    /// @param pattern the regex source, not null
    /// @param flags flag letters, may be null or empty
    /// @return the compiled pattern, never null
    /// @throws EvaluatorException if the pattern or a flag is invalid
    public static Pattern compile(String pattern, String flags) throws EvaluatorException {
        int bits = toBits(flags);
        try {
            return Pattern.compile(pattern, bits);
        } catch (PatternSyntaxException e) {
            throw new EvaluatorException("Invalid regex pattern: " + e.getDescription(), e);
        }
    }

    static int toBits(String flags) throws EvaluatorException {
        if (flags == null) {
            return 0;
        }
        int bits = 0;
        for (char c : flags.toCharArray()) {
            bits |=
                    switch (c) {
                        case 'i' -> Pattern.CASE_INSENSITIVE;
                        case 'm' -> Pattern.MULTILINE;
                        case 's' -> Pattern.DOTALL;
                        case 'u' -> Pattern.UNICODE_CASE;
                        case 'x' -> Pattern.COMMENTS;
                        case 'g' -> 0;
                        default -> throw new EvaluatorException("Unknown regex flag: " + c);
                    };
        }
        return bits;
    }
}
