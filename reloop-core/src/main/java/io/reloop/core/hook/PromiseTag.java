package io.reloop.core.hook;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Explicit promise an agent can embed in its output as `<promise>NAME</promise>`.
///
/// Tag and name match case-insensitively, so `<Promise>complete</Promise>` counts.
public enum PromiseTag {
    COMPLETE,
    BLOCKED,
    ESCALATE;

    private static final Pattern TAG =
            Pattern.compile(
                    "<promise>(COMPLETE|BLOCKED|ESCALATE)</promise>", Pattern.CASE_INSENSITIVE);

    /// Finds every promise tag in the output.
    ///
    /// @param output agent output, may be null
    /// @return the promises found, empty if none, never null
    public static Set<PromiseTag> scan(String output) {
        Set<PromiseTag> found = EnumSet.noneOf(PromiseTag.class);
        if (output == null || output.isEmpty()) {
            return found;
        }
        Matcher matcher = TAG.matcher(output);
        while (matcher.find()) {
            found.add(valueOf(matcher.group(1).toUpperCase(Locale.ROOT)));
        }
        return found;
    }

    /// Renders the tag as an agent would write it.
    ///
    /// @return e.g. `<promise>COMPLETE</promise>`, never null
    public String tag() {
        return "<promise>" + name() + "</promise>";
    }
}
