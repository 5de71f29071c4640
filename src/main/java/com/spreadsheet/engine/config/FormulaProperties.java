package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine tuning, bound from the "formula.*" keys in application.properties.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /** How long a computed cell result may be served from the result cache. */
    private Duration cacheTtl = Duration.ofSeconds(5);

    /** Deepest chain of formula cells evaluated inside one another before giving up with #ERROR!. */
    private int maxEvaluationDepth = 1024;

    /** Largest range a formula may expand; bigger ranges evaluate to #REF!. */
    private int maxRangeCells = 100_000;

    /** Zone NOW and TODAY are computed in; blank means the system default. */
    private String timeZone;

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public int getMaxEvaluationDepth() {
        return maxEvaluationDepth;
    }

    public void setMaxEvaluationDepth(int maxEvaluationDepth) {
        this.maxEvaluationDepth = maxEvaluationDepth;
    }

    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
