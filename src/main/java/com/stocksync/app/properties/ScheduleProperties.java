package com.stocksync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "schedule")
public class ScheduleProperties {
    private boolean enabled = false;
    private List<String> months = new ArrayList<>(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11", "12"));
    private String startTime = "00:00";
    private String endTime = "23:59";
    private int intervalMinutes = 15;
    private boolean runImmediately = false;
    private String zone = "";
    private String stateFile = "";
}
