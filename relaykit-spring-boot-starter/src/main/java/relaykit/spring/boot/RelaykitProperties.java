package relaykit.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for relaykit.
 *
 * @see RelaykitAutoConfiguration
 */
@ConfigurationProperties(prefix = "relaykit")
public class RelaykitProperties {

    private final Relay relay = new Relay();
    private final Preferences preferences = new Preferences();
    private final Metrics metrics = new Metrics();

    public Relay getRelay() {
        return relay;
    }

    public Preferences getPreferences() {
        return preferences;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Relay {
        private int workerCount = 4;
        private int mailboxCapacity = 1024;
        private long publishTimeoutMs = 1000;
        private long drainTimeoutMs = 5000;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getMailboxCapacity() {
            return mailboxCapacity;
        }

        public void setMailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
        }

        public long getPublishTimeoutMs() {
            return publishTimeoutMs;
        }

        public void setPublishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Preferences {
        private boolean enabled = true;

        /**
         * Backing JSON file. Preferences stay in memory when unset.
         */
        private String file;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relaykit";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
