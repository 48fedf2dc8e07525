package com.example.reconcile.model;

/**
 * Routing state of one issue across the two review phases.
 *
 * @param issueId          routed issue id
 * @param state            current lifecycle state
 * @param decisionRequired copied from the issue
 * @param severity         copied from the issue
 * @param resolution       human resolution, null until decided
 * @param resolvedValue    value chosen by the reviewer or the applied auto-fix
 * @param autoApplied      true when resolved through the caller's auto-apply policy
 */
public record IssueStatus(
        String issueId,
        IssueState state,
        boolean decisionRequired,
        Severity severity,
        Resolution resolution,
        String resolvedValue,
        boolean autoApplied
) {
    public static IssueStatus detected(Issue issue) {
        return new IssueStatus(issue.id(), IssueState.DETECTED, issue.decisionRequired(), issue.severity(),
                null, null, false);
    }

    public IssueStatus moveTo(IssueState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Issue %s cannot move from %s to %s"
                    .formatted(issueId, state.wireName(), target.wireName()));
        }
        return new IssueStatus(issueId, target, decisionRequired, severity, resolution, resolvedValue, autoApplied);
    }

    public IssueStatus decided(Resolution newResolution, String value) {
        IssueState target = newResolution == Resolution.DEFERRED ? IssueState.DEFERRED : IssueState.RESOLVED;
        IssueStatus moved = moveTo(target);
        return new IssueStatus(issueId, moved.state(), decisionRequired, severity, newResolution, value, false);
    }

    public IssueStatus autoResolved(String appliedValue) {
        IssueStatus moved = moveTo(IssueState.RESOLVED);
        return new IssueStatus(issueId, moved.state(), decisionRequired, severity, null, appliedValue, true);
    }

    /** Counts against approval while unresolved. */
    public boolean isBlocking() {
        return state != IssueState.RESOLVED && (decisionRequired || severity == Severity.HIGH);
    }
}
