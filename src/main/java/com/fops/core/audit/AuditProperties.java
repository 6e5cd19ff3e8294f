package com.fops.core.audit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fops.audit")
public class AuditProperties {

    private String logDir = "./audit_logs";
    private int defaultLookbackDays = 30;

    public String getLogDir() { return logDir; }
    public void setLogDir(String logDir) { this.logDir = logDir; }
    public int getDefaultLookbackDays() { return defaultLookbackDays; }
    public void setDefaultLookbackDays(int defaultLookbackDays) { this.defaultLookbackDays = defaultLookbackDays; }
}
