package net.checkin.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("checkin")
public class CheckinProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Notification notification = new Notification();
    private Executor executor = new Executor();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private Duration jitterMin = Duration.ofSeconds(30);
        private Duration jitterMax = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getJitterMin() {
            return jitterMin;
        }

        public void setJitterMin(Duration jitterMin) {
            this.jitterMin = jitterMin;
        }

        public Duration getJitterMax() {
            return jitterMax;
        }

        public void setJitterMax(Duration jitterMax) {
            this.jitterMax = jitterMax;
        }
    }

    public static class Notification {
        private String titlePrefix = "Check-in";
        private String telegramApiUrl = "https://api.telegram.org";
        private String wecomApiUrl = "https://qyapi.weixin.qq.com";
        private Duration timeout = Duration.ofSeconds(10);
        private Seed seed = new Seed();

        public String getTitlePrefix() {
            return titlePrefix;
        }

        public void setTitlePrefix(String titlePrefix) {
            this.titlePrefix = titlePrefix;
        }

        public String getTelegramApiUrl() {
            return telegramApiUrl;
        }

        public void setTelegramApiUrl(String telegramApiUrl) {
            this.telegramApiUrl = telegramApiUrl;
        }

        public String getWecomApiUrl() {
            return wecomApiUrl;
        }

        public void setWecomApiUrl(String wecomApiUrl) {
            this.wecomApiUrl = wecomApiUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Seed getSeed() {
            return seed;
        }

        public void setSeed(Seed seed) {
            this.seed = seed;
        }
    }

    /** Initial notification settings, stored only while the store has none. */
    public static class Seed {
        private boolean enabled = false;
        private String telegramBotToken;
        private String telegramUserId;
        private String wecomWebhookKey;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTelegramBotToken() {
            return telegramBotToken;
        }

        public void setTelegramBotToken(String telegramBotToken) {
            this.telegramBotToken = telegramBotToken;
        }

        public String getTelegramUserId() {
            return telegramUserId;
        }

        public void setTelegramUserId(String telegramUserId) {
            this.telegramUserId = telegramUserId;
        }

        public String getWecomWebhookKey() {
            return wecomWebhookKey;
        }

        public void setWecomWebhookKey(String wecomWebhookKey) {
            this.wecomWebhookKey = wecomWebhookKey;
        }
    }

    public static class Executor {
        private String url;
        private String method = "POST";
        private Duration timeout = Duration.ofSeconds(30);
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        private List<String> successKeywords = new ArrayList<>();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public List<String> getSuccessKeywords() {
            return successKeywords;
        }

        public void setSuccessKeywords(List<String> successKeywords) {
            this.successKeywords = successKeywords;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<AccountDef> accounts = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<AccountDef> getAccounts() {
            return accounts;
        }

        public void setAccounts(List<AccountDef> accounts) {
            this.accounts = accounts;
        }
    }

    public static class AccountDef {
        private String name;
        private String checkinTime;
        private boolean enabled = true;
        private String credentials;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCheckinTime() {
            return checkinTime;
        }

        public void setCheckinTime(String checkinTime) {
            this.checkinTime = checkinTime;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCredentials() {
            return credentials;
        }

        public void setCredentials(String credentials) {
            this.credentials = credentials;
        }

        @Override
        public String toString() {
            // credentials stay out of logs
            return "AccountDef{" +
                    "name='" + name + '\'' +
                    ", checkinTime='" + checkinTime + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
