package com.stocksync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "post-execution")
public class PostExecutionProperties {
    private boolean enabled = true;
    private int delayMinutes = 60;
}
