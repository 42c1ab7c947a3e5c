package net.checkin.bootstrap.autoconfigure;

import net.checkin.bootstrap.catalog.AccountCatalogRegistrar;
import net.checkin.bootstrap.props.CheckinProperties;
import net.checkin.core.model.NotificationConfig;
import net.checkin.core.service.CheckinOrchestrator;
import net.checkin.core.service.CheckinTimerLoop;
import net.checkin.core.service.NotificationSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Startup sequence: seed notification settings, register the catalog,
 * build the schedule, then start the timer.
 */
public class CheckinStartup implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CheckinStartup.class);

    private final CheckinProperties props;
    private final NotificationSettingsService notificationSettings;
    private final AccountCatalogRegistrar catalog;
    private final CheckinOrchestrator orchestrator;
    private final CheckinTimerLoop timer;

    public CheckinStartup(CheckinProperties props,
                          NotificationSettingsService notificationSettings,
                          AccountCatalogRegistrar catalog,
                          CheckinOrchestrator orchestrator,
                          CheckinTimerLoop timer) {
        this.props = props;
        this.notificationSettings = notificationSettings;
        this.catalog = catalog;
        this.orchestrator = orchestrator;
        this.timer = timer;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        var seed = props.getNotification().getSeed();
        notificationSettings.seedIfAbsent(new NotificationConfig(seed.isEnabled(),
                seed.getTelegramBotToken(), seed.getTelegramUserId(), seed.getWecomWebhookKey(), null));

        if (props.getCatalog().isEnabled()) {
            int n = catalog.register(props.getCatalog());
            if (n > 0) log.info("Catalog registered {} account(s)", n);
        }

        int scheduled = orchestrator.reconcile();
        if (props.getScheduler().isEnabled()) {
            timer.start();
            log.info("Check-in scheduler running: {} account(s), zone {}", scheduled, props.getZone());
        } else {
            log.info("Check-in scheduler disabled (checkin.scheduler.enabled=false); {} account(s) scheduled but not fired", scheduled);
        }
    }
}
