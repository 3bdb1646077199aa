package com.slotmonitor.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana RPC endpoint settings. Bound from SOLANA_RPC_URL / SOLANA_RPC_KEY in application.yml.
 */
@ConfigurationProperties(prefix = "slotmonitor.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** Base RPC URLs, rotated round-robin. At least one is required. */
    @NotEmpty
    private List<String> urls = new ArrayList<>();

    /** Optional API key appended as the last path segment of every URL (keyed-endpoint providers). */
    private String apiKey;

    /** Client-side request budget across tracker, workers and the HTTP endpoint. */
    @Min(1)
    private int maxRequestsPerSecond = 50;

    /** How long a caller may wait for a rate-limiter permit before the call fails. */
    @Min(0)
    private long limiterTimeoutMs = 2_000;

    /** Per-request timeout. */
    @Min(1)
    private long requestTimeoutMs = 10_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }

    /**
     * URLs with the API key appended, trailing slashes normalized. Blank entries are skipped.
     * Values read from a .env file keep their quotes, so one pair of surrounding quotes is removed here.
     */
    public List<String> resolvedEndpoints() {
        String key = unquote(apiKey);
        List<String> endpoints = new ArrayList<>();
        for (String url : urls) {
            String base = unquote(url);
            if (base.isEmpty()) {
                continue;
            }
            while (base.endsWith("/")) {
                base = base.substring(0, base.length() - 1);
            }
            endpoints.add(key.isEmpty() ? base : base + "/" + key);
        }
        return endpoints;
    }

    static String unquote(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
            }
        }
        return trimmed;
    }
}
