package com.stocksync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:sqlserver://localhost:1433;databaseName=x3;encrypt=false";
    private String user;
    private String pass;
    private String schema = "dbo";
}
