package com.stocksync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "codes")
public class CodesProperties {
    private String table = "FACILITY";
    private String column = "FCY_0";
    private Map<String, String> filter = new LinkedHashMap<>();
}
