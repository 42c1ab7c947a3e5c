package net.checkin.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.checkin.adapter.http.JsonHttp;
import net.checkin.adapter.http.executor.HttpCheckinExecutor;
import net.checkin.adapter.http.notify.TelegramChannel;
import net.checkin.adapter.http.notify.WecomChannel;
import net.checkin.bootstrap.catalog.AccountCatalogRegistrar;
import net.checkin.bootstrap.props.CheckinProperties;
import net.checkin.core.model.CheckinResult;
import net.checkin.core.service.*;
import net.checkin.core.spi.*;
import net.checkin.integration.spring.CheckinSpringConfig;
import net.checkin.integration.spring.cron.CronUtilsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.net.URI;
import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(CheckinProperties.class)
@Import(CheckinSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class CheckinAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CheckinAutoConfiguration.class);

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public JitterPolicy jitterPolicy(CheckinProperties props) {
        var s = props.getScheduler();
        return JitterPolicy.uniform(s.getJitterMin(), s.getJitterMax());
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    // --- HTTP adapters ---

    @Bean
    @ConditionalOnMissingBean
    public JsonHttp checkinJsonHttp(ObjectProvider<ObjectMapper> mapper, CheckinProperties props) {
        var timeout = props.getNotification().getTimeout();
        return new JsonHttp(JsonHttp.defaultClient(timeout), mapper.getIfAvailable(ObjectMapper::new), timeout);
    }

    @Bean
    public TelegramChannel telegramChannel(JsonHttp http, CheckinProperties props) {
        return new TelegramChannel(http, props.getNotification().getTelegramApiUrl());
    }

    @Bean
    public WecomChannel wecomChannel(JsonHttp http, CheckinProperties props) {
        return new WecomChannel(http, props.getNotification().getWecomApiUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinExecutor checkinExecutor(ObjectProvider<ObjectMapper> mapper, CheckinProperties props) {
        var e = props.getExecutor();
        if (e.getUrl() == null || e.getUrl().isBlank()) {
            log.warn("checkin.executor.url is not set; every check-in will be recorded as failed");
            return account -> CheckinResult.failed("check-in endpoint not configured");
        }
        var settings = new HttpCheckinExecutor.Settings(URI.create(e.getUrl()), e.getMethod(), e.getTimeout(),
                e.getUserAgent(), e.getSuccessKeywords());
        return new HttpCheckinExecutor(JsonHttp.defaultClient(e.getTimeout()), mapper.getIfAvailable(ObjectMapper::new), settings);
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationSettingsRepository settings,
                                                         ObjectProvider<NotificationChannel> channels,
                                                         TxRunner tx,
                                                         CheckinProperties props) {
        var list = channels.orderedStream().collect(Collectors.toList());
        log.info("Notification channels: {}", list.stream().map(NotificationChannel::name).collect(Collectors.toList()));
        return new NotificationDispatcher(settings, list, tx, props.getNotification().getTitlePrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleTable scheduleTable(CronCalculator cron, Clock clock, CheckinProperties props) {
        return new ScheduleTable(cron, ZoneId.of(props.getZone()), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinOrchestrator checkinOrchestrator(ScheduleTable schedule,
                                                   AccountRepository accounts,
                                                   CheckinExecutor executor,
                                                   HistoryRecorder history,
                                                   NotificationDispatcher dispatcher,
                                                   TxRunner tx,
                                                   Clock clock,
                                                   JitterPolicy jitter,
                                                   Sleeper sleeper) {
        var collaborators = new ExecutionUnit.Collaborators(
                accounts, executor, history, dispatcher, tx, clock, schedule.zone());
        return new CheckinOrchestrator(schedule, collaborators, jitter, sleeper);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public CheckinTimerLoop checkinTimerLoop(CheckinOrchestrator orchestrator, CheckinProperties props) {
        var s = props.getScheduler();
        return new CheckinTimerLoop(orchestrator, s.getTickInterval(), s.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountAdminService accountAdminService(AccountRepository accounts,
                                                   CheckinOrchestrator orchestrator,
                                                   TxRunner tx,
                                                   Clock clock) {
        return new AccountAdminService(accounts, orchestrator, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSettingsService notificationSettingsService(NotificationSettingsRepository settings,
                                                                   TxRunner tx,
                                                                   Clock clock) {
        return new NotificationSettingsService(settings, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DashboardService dashboardService(AccountRepository accounts,
                                             HistoryReportRepository history,
                                             TxRunner tx,
                                             Clock clock,
                                             CheckinProperties props) {
        return new DashboardService(accounts, history, tx, clock, ZoneId.of(props.getZone()));
    }

    // --- startup ---

    @Bean
    public AccountCatalogRegistrar accountCatalogRegistrar(AccountRepository accounts, TxRunner tx) {
        return new AccountCatalogRegistrar(accounts, tx);
    }

    @Bean
    public CheckinStartup checkinStartup(CheckinProperties props,
                                         NotificationSettingsService notificationSettings,
                                         AccountCatalogRegistrar catalog,
                                         CheckinOrchestrator orchestrator,
                                         CheckinTimerLoop timer) {
        return new CheckinStartup(props, notificationSettings, catalog, orchestrator, timer);
    }
}
