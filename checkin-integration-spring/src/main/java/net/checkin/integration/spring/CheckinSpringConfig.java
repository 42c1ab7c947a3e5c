package net.checkin.integration.spring;

import net.checkin.adapter.jdbc.repo.JdbcAccountRepository;
import net.checkin.adapter.jdbc.repo.JdbcCheckinHistoryRepository;
import net.checkin.adapter.jdbc.repo.JdbcNotificationSettingsRepository;
import net.checkin.core.spi.*;
import net.checkin.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class CheckinSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // repositories (adapter-jdbc)
    @Bean public AccountRepository accountRepository(Clock clock) { return new JdbcAccountRepository(clock); }
    @Bean public JdbcCheckinHistoryRepository checkinHistoryRepository() { return new JdbcCheckinHistoryRepository(); }
    @Bean public NotificationSettingsRepository notificationSettingsRepository(Clock clock) {
        return new JdbcNotificationSettingsRepository(clock);
    }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
