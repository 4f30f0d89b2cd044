package com.gatehouse.api.application;

import com.gatehouse.observability.MetricFactory;
import com.gatehouse.security.DenialReason;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Login and access-guard counters.
 *
 * <ul>
 *   <li>{@code gatehouse.auth.logins{outcome=success|failure|error}}
 *   <li>{@code gatehouse.auth.login.duration}
 *   <li>{@code gatehouse.auth.denials{reason=<denial reason>}}
 * </ul>
 */
@Component
public class AuthMetrics {

    public static final String LOGINS = "gatehouse.auth.logins";
    public static final String LOGIN_DURATION = "gatehouse.auth.login.duration";
    public static final String DENIALS = "gatehouse.auth.denials";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_ERROR = "error";

    private final MetricFactory metrics;
    private final Timer loginTimer;

    public AuthMetrics(MetricFactory metrics) {
        this.metrics = metrics;
        this.loginTimer = metrics.timer(LOGIN_DURATION, "Time spent verifying credentials and issuing a token");
    }

    public void recordLogin(String outcome) {
        metrics.counter(LOGINS, "Login attempts by outcome", "outcome", outcome).increment();
    }

    public void recordDenial(DenialReason reason) {
        metrics.counter(DENIALS, "Requests rejected by an access guard", "reason", reason.tag()).increment();
    }

    public <T> T timeLogin(Supplier<T> login) {
        return loginTimer.record(login);
    }
}
