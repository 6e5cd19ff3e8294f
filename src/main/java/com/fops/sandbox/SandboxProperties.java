package com.fops.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fops.sandbox")
public class SandboxProperties {

    private String terraformBinary = "terraform";
    private String helmBinary = "helm";
    private int initTimeoutSeconds = 60;
    private int planTimeoutSeconds = 120;
    private int lintTimeoutSeconds = 30;
    private int dryRunTimeoutSeconds = 60;
    private String workDirPrefix = "fops-sandbox-";
    private int maxParallel = 4;

    public String getTerraformBinary() { return terraformBinary; }
    public void setTerraformBinary(String terraformBinary) { this.terraformBinary = terraformBinary; }
    public String getHelmBinary() { return helmBinary; }
    public void setHelmBinary(String helmBinary) { this.helmBinary = helmBinary; }
    public int getInitTimeoutSeconds() { return initTimeoutSeconds; }
    public void setInitTimeoutSeconds(int initTimeoutSeconds) { this.initTimeoutSeconds = initTimeoutSeconds; }
    public int getPlanTimeoutSeconds() { return planTimeoutSeconds; }
    public void setPlanTimeoutSeconds(int planTimeoutSeconds) { this.planTimeoutSeconds = planTimeoutSeconds; }
    public int getLintTimeoutSeconds() { return lintTimeoutSeconds; }
    public void setLintTimeoutSeconds(int lintTimeoutSeconds) { this.lintTimeoutSeconds = lintTimeoutSeconds; }
    public int getDryRunTimeoutSeconds() { return dryRunTimeoutSeconds; }
    public void setDryRunTimeoutSeconds(int dryRunTimeoutSeconds) { this.dryRunTimeoutSeconds = dryRunTimeoutSeconds; }
    public String getWorkDirPrefix() { return workDirPrefix; }
    public void setWorkDirPrefix(String workDirPrefix) { this.workDirPrefix = workDirPrefix; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
}
