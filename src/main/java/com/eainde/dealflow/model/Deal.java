package com.eainde.dealflow.model;

import java.io.Serializable;

/**
 * Deal facts a run needs; read once from the deal store at trigger time.
 */
public record Deal(
        String id,
        String title,
        String clientName,
        String description,
        Double dealValue,
        Integer healthScore,
        Integer previousHealthScore,
        String stage
) implements Serializable {
}
