package com.slotmonitor.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-call RPC retry (exponential backoff ± jitter). Failures left after the last attempt surface to the caller.
 */
@ConfigurationProperties(prefix = "slotmonitor.rpc.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RpcRetryProperties {

    @Min(0)
    private long baseDelayMs = 200L;

    @Min(0)
    private long maxDelayMs = 2_000L;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. */
    @Min(1)
    private int maxAttempts = 3;
}
