package io.reloop.server.iteration;

import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointChain;
import io.reloop.core.iteration.IterationListener;
import io.reloop.core.iteration.IterationVerdict;
import io.reloop.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/// Writes one log line per iteration lifecycle event.
///
/// ### Log Format
/// ```
/// [task-42] started chain 3f2a... (max 10 iterations, 3 rules)
/// [task-42] iteration 2 validated: score=66 signal=CONTINUE
/// [task-42] iteration 2 escalated by circuit_breaker: 3 consecutive failures
/// [task-42] advanced to iteration 3 (checkpoint 9b41...)
/// [task-42] closed as ESCALATED after sequence 3
/// ```
///
/// Escalations log at WARN, everything else at INFO.
///
/// @implNote Thread-safe. Stateless.
@ApplicationScoped
public class LoggingIterationListener implements IterationListener {

    private static final Logger LOG = Logger.getLogger(LoggingIterationListener.class);

    @Override
    public void onStart(Checkpoint checkpoint) {
        LOG.infov(
                "[{0}] started chain {1} (max {2} iterations, {3} rules)",
                LogSanitizer.sanitize(checkpoint.taskId()),
                checkpoint.chainId(),
                checkpoint.iterationConfig().getMaxIterations(),
                checkpoint.iterationConfig().getValidationRules().size());
    }

    @Override
    public void onValidated(String taskId, IterationVerdict verdict) {
        int iteration = verdict.report().iterationNumber();
        if (verdict.escalation() != null) {
            LOG.warnv(
                    "[{0}] iteration {1} escalated by {2}: {3}",
                    LogSanitizer.sanitize(taskId),
                    iteration,
                    verdict.escalation().guard(),
                    verdict.escalation().reason());
            return;
        }
        LOG.infov(
                "[{0}] iteration {1} validated: score={2} signal={3}",
                LogSanitizer.sanitize(taskId),
                iteration,
                verdict.validationScore(),
                verdict.signal());
    }

    @Override
    public void onAdvance(Checkpoint checkpoint) {
        LOG.infov(
                "[{0}] advanced to iteration {1} (checkpoint {2})",
                LogSanitizer.sanitize(checkpoint.taskId()),
                checkpoint.iterationNumber(),
                checkpoint.id());
    }

    @Override
    public void onComplete(CheckpointChain chain) {
        LOG.infov(
                "[{0}] closed as {1} after sequence {2}",
                LogSanitizer.sanitize(chain.taskId()), chain.status(), chain.latestSequence());
    }
}
