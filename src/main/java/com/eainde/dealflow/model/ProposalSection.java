package com.eainde.dealflow.model;

import java.io.Serializable;

public record ProposalSection(String title, String content) implements Serializable {
}
