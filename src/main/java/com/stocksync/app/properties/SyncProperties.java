package com.stocksync.app.properties;

import com.stocksync.sync.SyncPlan;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private Local local = new Local();
    private String returnsSubdir = SyncPlan.DEFAULT_RETURNS_SUBDIR;
    private Rules rules = new Rules();

    @Getter
    @Setter
    public static class Local {
        private String exportDir = "export";
        private String archiveDir = "export/archive";
        private String importDir = "import";
    }

    @Getter
    @Setter
    public static class Rules {
        private String main = SyncPlan.DEFAULT_MAIN_RULES;
        private String returns = SyncPlan.DEFAULT_RETURNS_RULES;
    }
}
