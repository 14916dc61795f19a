package com.stocksync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "sftp")
public class SftpProperties {
    private String host;
    private int port = 22;
    private String user;
    private String password = "";
    private String hostKey;
    private int timeoutSec = 30;
    private String syncBasePath = "exportx3/automation";
}
