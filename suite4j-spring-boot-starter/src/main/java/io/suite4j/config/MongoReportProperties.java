package io.suite4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Switches for the MongoDB report sink.
 */
@ConfigurationProperties(prefix = "suite4j.report.mongo")
public class MongoReportProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;
    private boolean recordMethodHistory = true; // $push every accepted method result

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isRecordMethodHistory() {
        return recordMethodHistory;
    }

    public void setRecordMethodHistory(boolean recordMethodHistory) {
        this.recordMethodHistory = recordMethodHistory;
    }
}
