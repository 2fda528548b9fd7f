package io.github.yok.rethinkdblink.core;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Outcome of provisioning one database or table.
 *
 * <p>
 * A {@link ProvisioningOutcome#FAILED} result carries a detail message and, when the failure came
 * from the driver, the exception that caused it. Results are produced once per step and never
 * retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProvisioningResult {

    static final String PREFIX = "[RethinkSession] --- ";

    private final EntityKind kind;
    private final String name;
    private final ProvisioningOutcome outcome;
    @Getter(AccessLevel.NONE)
    private final String detail;
    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final Throwable cause;

    /**
     * Result for an entity that was already present.
     *
     * @param kind entity kind
     * @param name entity name
     * @return result
     */
    public static ProvisioningResult alreadyExisted(EntityKind kind, String name) {
        return new ProvisioningResult(kind, name, ProvisioningOutcome.ALREADY_EXISTED, null, null);
    }

    /**
     * Result for an entity this session created.
     *
     * @param kind entity kind
     * @param name entity name
     * @return result
     */
    public static ProvisioningResult created(EntityKind kind, String name) {
        return new ProvisioningResult(kind, name, ProvisioningOutcome.CREATED, null, null);
    }

    /**
     * Result for a failed step.
     *
     * @param kind entity kind
     * @param name entity name
     * @param detail what went wrong
     * @param cause driver exception, or {@code null} when the server answered without error
     * @return result
     */
    public static ProvisioningResult failed(EntityKind kind, String name, String detail,
            Throwable cause) {
        return new ProvisioningResult(kind, name, ProvisioningOutcome.FAILED, detail, cause);
    }

    /**
     * Result for a step that did not run.
     *
     * @param kind entity kind
     * @param name entity name
     * @param reason why the step was skipped
     * @return result
     */
    public static ProvisioningResult skipped(EntityKind kind, String name, String reason) {
        return new ProvisioningResult(kind, name, ProvisioningOutcome.SKIPPED, reason, null);
    }

    public boolean isCreated() {
        return outcome == ProvisioningOutcome.CREATED;
    }

    public boolean isFailed() {
        return outcome == ProvisioningOutcome.FAILED;
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Renders the operator-facing status line, e.g.
     * {@code [RethinkSession] --- Successfully created new DATABASE --- default}.
     *
     * @return status line
     */
    public String statusLine() {
        switch (outcome) {
            case CREATED:
                return PREFIX + "Successfully created new " + kind + " --- " + name;
            case ALREADY_EXISTED:
                return PREFIX + kind + " already exists --- " + name;
            case SKIPPED:
                return PREFIX + "Skipped " + kind + " --- " + name
                        + (detail != null ? " (" + detail + ")" : "");
            case FAILED:
            default:
                StringBuilder sb = new StringBuilder(PREFIX).append("Failed to create new ")
                        .append(kind).append(" --- ").append(name);
                if (detail != null) {
                    sb.append(": ").append(detail);
                }
                if (cause != null) {
                    sb.append(" (").append(ExceptionUtils.getRootCauseMessage(cause)).append(')');
                }
                return sb.toString();
        }
    }

    @Override
    public String toString() {
        return kind + "(" + name + ")=" + outcome;
    }
}
