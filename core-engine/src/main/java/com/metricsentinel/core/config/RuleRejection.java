package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * A configuration entry excluded at load time, with the reason.
 *
 * @since 1.0.0
 */
public final class RuleRejection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ruleId;
    private final String reason;

    public RuleRejection(String ruleId, String reason) {
        this.ruleId = ruleId;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /** Id of the rejected rule; {@code null} if the rule had none. */
    public String getRuleId() {
        return ruleId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "RuleRejection{ruleId='" + ruleId + "', reason='" + reason + "'}";
    }
}
