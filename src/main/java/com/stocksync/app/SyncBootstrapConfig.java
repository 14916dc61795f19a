package com.stocksync.app;

import com.stocksync.app.properties.CodesProperties;
import com.stocksync.app.properties.DbProperties;
import com.stocksync.app.properties.PostExecutionProperties;
import com.stocksync.app.properties.ScheduleProperties;
import com.stocksync.app.properties.SftpProperties;
import com.stocksync.app.properties.SyncProperties;
import com.stocksync.config.ScheduleConfig;
import com.stocksync.db.Database;
import com.stocksync.db.MyBatisRecordSession;
import com.stocksync.routing.RoutingTable;
import com.stocksync.scheduler.TimeWindowScheduler;
import com.stocksync.sync.DestinationCodeDao;
import com.stocksync.sync.SyncOrchestrator;
import com.stocksync.sync.SyncPlan;
import com.stocksync.transfer.SftpSettings;
import com.stocksync.transfer.SftpTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties({
        ScheduleProperties.class,
        PostExecutionProperties.class,
        SftpProperties.class,
        DbProperties.class,
        SyncProperties.class,
        CodesProperties.class
})
public class SyncBootstrapConfig {

    @Bean
    public ScheduleConfig scheduleConfig(ScheduleProperties schedule, PostExecutionProperties postExecution) {
        return ScheduleConfig.of(
                schedule.isEnabled(),
                schedule.getMonths(),
                schedule.getStartTime(),
                schedule.getEndTime(),
                schedule.getIntervalMinutes(),
                schedule.isRunImmediately(),
                postExecution.getDelayMinutes(),
                schedule.getZone()
        );
    }

    @Bean
    @Lazy
    public SftpSettings sftpSettings(SftpProperties sftp) {
        return new SftpSettings(
                sftp.getHost(),
                sftp.getPort(),
                sftp.getUser(),
                sftp.getPassword(),
                sftp.getHostKey(),
                sftp.getTimeoutSec()
        );
    }

    @Bean
    @Lazy
    public Database database(DbProperties db) {
        return new Database(db.getUrl(), db.getUser(), db.getPass(), db.getSchema());
    }

    @Bean
    public SyncPlan syncPlan(SyncProperties sync, SftpProperties sftp) {
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return SyncPlan.of(
                workingDir.resolve(sync.getLocal().getExportDir()).normalize(),
                workingDir.resolve(sync.getLocal().getArchiveDir()).normalize(),
                workingDir.resolve(sync.getLocal().getImportDir()).normalize(),
                sftp.getSyncBasePath(),
                sync.getReturnsSubdir(),
                RoutingTable.parse(sync.getRules().getMain()),
                RoutingTable.parse(sync.getRules().getReturns())
        );
    }

    @Bean
    public DestinationCodeDao destinationCodeDao(CodesProperties codes) {
        return DestinationCodeDao.of(codes.getTable(), codes.getColumn(), codes.getFilter());
    }

    /**
     * SFTP settings and the database are resolved on first use, so the context starts without
     * either being reachable.
     */
    @Bean
    public SyncOrchestrator syncOrchestrator(
            SyncPlan plan,
            ObjectProvider<SftpSettings> sftpSettings,
            ObjectProvider<Database> database,
            DestinationCodeDao destinationCodeDao
    ) {
        return new SyncOrchestrator(
                plan,
                () -> SftpTransport.connect(sftpSettings.getObject()),
                () -> MyBatisRecordSession.open(database.getObject()),
                destinationCodeDao
        );
    }

    @Bean
    @Lazy
    public TimeWindowScheduler timeWindowScheduler(
            ScheduleConfig scheduleConfig,
            ScheduleProperties schedule,
            PostExecutionProperties postExecution,
            SyncOrchestrator syncOrchestrator
    ) {
        String stateFile = schedule.getStateFile();
        Path statePath = stateFile == null || stateFile.isBlank() ? null : Path.of(stateFile.trim());
        return SyncScheduling.create(scheduleConfig, syncOrchestrator, postExecution.isEnabled(), statePath);
    }
}
