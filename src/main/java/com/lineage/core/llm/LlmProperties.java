package com.lineage.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "lineage.llm")
public class LlmProperties {

    private String model = "gpt-4o-mini";
    private String mergeModel = "gpt-4o";
    private int maxParseRetries = 2;
    private double costPerThousandTokens = 0.002;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getMergeModel() {
        return mergeModel;
    }

    public void setMergeModel(String mergeModel) {
        this.mergeModel = mergeModel;
    }

    public int getMaxParseRetries() {
        return maxParseRetries;
    }

    public void setMaxParseRetries(int maxParseRetries) {
        this.maxParseRetries = maxParseRetries;
    }

    public double getCostPerThousandTokens() {
        return costPerThousandTokens;
    }

    public void setCostPerThousandTokens(double costPerThousandTokens) {
        this.costPerThousandTokens = costPerThousandTokens;
    }

    public double costOf(long tokens) {
        return tokens / 1000.0 * costPerThousandTokens;
    }
}
