package io.reloop.core.guard;

import io.reloop.core.checkpoint.HistoryEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Escalates when the same files keep showing up in failures.
///
/// Failure messages that mention `file: <path>` are tallied across the history.
/// Any path reaching `thrashingThreshold` mentions indicates the loop is churning on
/// the same files without progress.
public final class ThrashingGuard implements SafetyGuard {

    public static final String NAME = "thrashing";

    private static final Pattern FILE_REFERENCE =
            Pattern.compile("file:\\s*([^\\s,]+)", Pattern.CASE_INSENSITIVE);

    private static final int MAX_LISTED_FILES = 3;

    @Override
    public Optional<Escalation> check(GuardContext context) {
        int threshold = context.config().getThrashingThreshold();
        if (context.history().size() < threshold) {
            return Optional.empty();
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (HistoryEntry entry : context.history()) {
            for (String message : entry.failureMessages()) {
                Matcher matcher = FILE_REFERENCE.matcher(message);
                while (matcher.find()) {
                    counts.merge(matcher.group(1), 1, Integer::sum);
                }
            }
        }

        List<String> thrashed = new ArrayList<>();
        counts.forEach(
                (file, count) -> {
                    if (count >= threshold) {
                        thrashed.add(file + " (" + count + "x)");
                    }
                });
        if (thrashed.isEmpty()) {
            return Optional.empty();
        }

        List<String> evidence =
                thrashed.size() > MAX_LISTED_FILES
                        ? new ArrayList<>(thrashed.subList(0, MAX_LISTED_FILES))
                        : new ArrayList<>(thrashed);
        if (thrashed.size() > MAX_LISTED_FILES) {
            evidence.add("and " + (thrashed.size() - MAX_LISTED_FILES) + " more");
        }
        return Optional.of(
                new Escalation(
                        NAME,
                        thrashed.size() + " file(s) failing repeatedly without progress",
                        evidence));
    }
}
