package com.eainde.dealflow.model;

import java.io.Serializable;

public record DealAlert(
        AlertType type,
        AlertSeverity severity,
        String title,
        String description
) implements Serializable {

    public boolean isPositive() {
        return type == AlertType.POSITIVE_UPDATE;
    }
}
