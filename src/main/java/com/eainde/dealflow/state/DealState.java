package com.eainde.dealflow.state;

import com.eainde.dealflow.model.Deal;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * State shared by every deal flow. Stages add keys; only {@link #CURRENT_STAGE}
 * is ever overwritten, and {@link #ERRORS} only grows.
 */
public class DealState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String DEAL_ID = "dealId";
    public static final String DEAL = "deal";
    public static final String CURRENT_STAGE = "currentStage";
    public static final String ERRORS = "errors";

    public DealState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() {
        return this.<String>value(RUN_ID).orElse(null);
    }

    public String getDealId() {
        return this.<String>value(DEAL_ID).orElse(null);
    }

    public Deal getDeal() {
        return this.<Deal>value(DEAL).orElse(null);
    }

    public String getCurrentStage() {
        return this.<String>value(CURRENT_STAGE).orElse("");
    }

    public List<String> getErrors() {
        return listOf(ERRORS);
    }

    /**
     * The error accumulator with {@code messages} appended, ready to be put in a
     * stage's partial update.
     */
    public List<String> errorsWith(String... messages) {
        List<String> errors = new ArrayList<>(getErrors());
        errors.addAll(Arrays.asList(messages));
        return List.copyOf(errors);
    }

    @SuppressWarnings("unchecked")
    protected <T> List<T> listOf(String key) {
        Object value = data().get(key);
        return value instanceof List<?> list ? (List<T>) list : List.of();
    }

    protected int intOf(String key, int fallback) {
        Object value = data().get(key);
        return value instanceof Number number ? number.intValue() : fallback;
    }

    protected double doubleOf(String key, double fallback) {
        Object value = data().get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    protected String stringOf(String key) {
        Object value = data().get(key);
        return value instanceof String s ? s : "";
    }
}
