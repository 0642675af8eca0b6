package io.reloop.core.validation.evaluator;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.CommandRule;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Evaluates {@link CommandRule}s by running the command through `/bin/sh -c`.
///
/// ### Timeout
/// The wait is bounded by the rule's timeout, falling back to the default passed at
/// construction. On expiry the process and all of its descendants are destroyed
/// forcibly and an {@link EvaluatorException} is raised, so a runaway command never
/// hangs a validation pass.
///
/// Process output is redirected to temporary files rather than read from pipes.
/// A command that floods stdout therefore cannot stall the wait, and a descendant
/// that keeps a pipe open after the timeout cannot block the reader.
///
/// ### Result Details
/// - `exitCode` / `expectedExitCode`
/// - `stdout` / `stderr` truncated to {@value #MAX_OUTPUT_CHARS} characters
///
/// @implNote Thread-safe. Each call spawns its own process and temp files.
public final class CommandRuleEvaluator implements RuleEvaluator<CommandRule> {

    private static final Logger logger = Logger.getLogger(CommandRuleEvaluator.class.getName());

    static final int MAX_OUTPUT_CHARS = 1000;

    private final Duration defaultTimeout;

    /// Creates an evaluator.
    ///
    /// @param defaultTimeout timeout applied to rules that declare none, not null
    public CommandRuleEvaluator(Duration defaultTimeout) {
        this.defaultTimeout =
                Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
    }

    @Override
    public RuleOutcome evaluate(CommandRule rule, ValidationContext context)
            throws EvaluatorException {
        Duration timeout = rule.timeout() != null ? rule.timeout() : defaultTimeout;
        Path directory = resolveDirectory(rule, context);

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("reloop-cmd-", ".out");
            stderrFile = Files.createTempFile("reloop-cmd-", ".err");

            ProcessBuilder pb = new ProcessBuilder(List.of("/bin/sh", "-c", rule.command()));
            pb.directory(directory.toFile());
            pb.environment().putAll(rule.env());
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));

            Process process = startProcess(pb, rule);
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                throw new EvaluatorException(
                        "Command timed out after " + timeout.toMillis() + " ms");
            }

            int exitCode = process.exitValue();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exitCode", exitCode);
            details.put("expectedExitCode", rule.expectedExitCode());
            details.put("stdout", readTruncated(stdoutFile));
            details.put("stderr", readTruncated(stderrFile));

            if (exitCode == rule.expectedExitCode()) {
                return RuleOutcome.pass(
                        "Command exited with expected code " + exitCode, details);
            }
            return RuleOutcome.fail(
                    "Command exited with code "
                            + exitCode
                            + ", expected "
                            + rule.expectedExitCode(),
                    details);
        } catch (IOException e) {
            throw new EvaluatorException("Command execution failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluatorException("Command interrupted", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private Process startProcess(ProcessBuilder pb, CommandRule rule) throws EvaluatorException {
        try {
            return pb.start();
        } catch (IOException e) {
            throw new EvaluatorException(
                    "Failed to spawn command for rule '" + rule.name() + "': " + e.getMessage(),
                    e);
        }
    }

    private static Path resolveDirectory(CommandRule rule, ValidationContext context)
            throws EvaluatorException {
        Path directory =
                rule.workingDirectory() != null
                        ? context.workingDirectory().resolve(rule.workingDirectory())
                        : context.workingDirectory();
        if (!Files.isDirectory(directory)) {
            throw new EvaluatorException("Working directory does not exist: " + directory);
        }
        return directory;
    }

    /// Kills descendants first so a shell wrapper cannot leave orphans behind.
    private static void destroyTree(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        if (!process.waitFor(5, TimeUnit.SECONDS)) {
            logger.warning("Process " + process.pid() + " did not exit after forced kill");
        }
    }

    private static String readTruncated(Path file) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return content.length() > MAX_OUTPUT_CHARS
                ? content.substring(0, MAX_OUTPUT_CHARS)
                : content;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.fine("Could not delete temp file " + file + ": " + e.getMessage());
        }
    }
}
