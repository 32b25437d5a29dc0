package com.eainde.dealflow.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One client communication (email, message) supplied for monitoring.
 */
public record Communication(
        String channel,
        String from,
        String subject,
        Instant receivedAt,
        String content
) implements Serializable {
}
