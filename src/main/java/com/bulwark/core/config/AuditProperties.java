package com.bulwark.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "bulwark")
public class AuditProperties {

    private Map<String, String> components = defaultComponents();
    private List<String> ignoreDirs = new ArrayList<>(List.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next"
    ));
    private int passPercentage = 70;
    private Ranking ranking = new Ranking();

    private static Map<String, String> defaultComponents() {
        var components = new LinkedHashMap<String, String>();
        components.put("bridge", ".");
        components.put("server", "mcp-server");
        return components;
    }

    public Map<String, String> getComponents() {
        return components;
    }

    public void setComponents(Map<String, String> components) {
        this.components = components;
    }

    public List<String> getIgnoreDirs() {
        return ignoreDirs;
    }

    public void setIgnoreDirs(List<String> ignoreDirs) {
        this.ignoreDirs = ignoreDirs;
    }

    public int getPassPercentage() {
        return passPercentage;
    }

    public void setPassPercentage(int passPercentage) {
        this.passPercentage = passPercentage;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public static class Ranking {
        private List<String> securityCriticalChecks = new ArrayList<>(List.of(
                "Vulnerabilities",
                "Code-Review",
                "Branch-Protection",
                "Token-Permissions",
                "Dangerous-Workflow",
                "Security-Policy"
        ));
        private int improveThreshold = 7;

        public List<String> getSecurityCriticalChecks() {
            return securityCriticalChecks;
        }

        public void setSecurityCriticalChecks(List<String> securityCriticalChecks) {
            this.securityCriticalChecks = securityCriticalChecks;
        }

        public int getImproveThreshold() {
            return improveThreshold;
        }

        public void setImproveThreshold(int improveThreshold) {
            this.improveThreshold = improveThreshold;
        }
    }
}
