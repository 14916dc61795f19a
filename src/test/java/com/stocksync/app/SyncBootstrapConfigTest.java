package com.stocksync.app;

import com.stocksync.config.ScheduleConfig;
import com.stocksync.routing.RoutingTable;
import com.stocksync.scheduler.TimeWindowScheduler;
import com.stocksync.sync.SyncOrchestrator;
import com.stocksync.sync.SyncPlan;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncBootstrapConfigTest {

    @Test
    void bindsPropertiesIntoScheduleAndPlan() {
        Map<String, Object> props = new HashMap<>();
        props.put("schedule.enabled", "true");
        props.put("schedule.months", "6,7,8");
        props.put("schedule.start-time", "22:00");
        props.put("schedule.end-time", "06:00");
        props.put("schedule.interval-minutes", "10");
        props.put("schedule.zone", "UTC");
        props.put("post-execution.delay-minutes", "30");
        props.put("sftp.sync-base-path", "/srv/x3");
        props.put("sync.local.export-dir", "target/bootstrap/export");
        props.put("sync.rules.main", "^INV(\\d{2}) => E{code}");

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", props));
            context.register(SyncBootstrapConfig.class);
            context.refresh();

            ScheduleConfig schedule = context.getBean(ScheduleConfig.class);
            assertTrue(schedule.enabled());
            assertEquals(Set.of(6, 7, 8), schedule.allowedMonths());
            assertEquals(LocalTime.of(22, 0), schedule.windowStart());
            assertTrue(schedule.isWithinWindow(LocalTime.of(23, 30)));
            assertFalse(schedule.isWithinWindow(LocalTime.of(12, 0)));
            assertEquals(10, schedule.intervalMinutes());
            assertEquals(30, schedule.postExecutionDelayMinutes());
            assertEquals(ZoneId.of("UTC"), schedule.zone());

            SyncPlan plan = context.getBean(SyncPlan.class);
            assertEquals("/srv/x3", plan.remoteBasePath());
            assertTrue(plan.exportDir().endsWith("target/bootstrap/export"));
            assertEquals(2, plan.passes().size());
            RoutingTable mainRules = plan.passes().get(0).rules();
            assertEquals(Optional.of("E42"), mainRules.resolve("INV42.csv"));
            assertEquals(Optional.of("E07/recolhas"), plan.passes().get(1).rules().resolve("RECE07.csv"));

            assertNotNull(context.getBean(SyncOrchestrator.class));
            assertNotNull(context.getBean(TimeWindowScheduler.class));
        }
    }
}
