package com.example.orchestrator.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Phone phone = new Phone();

    @NestedConfigurationProperty
    private final Gateway gateway = new Gateway();

    @NestedConfigurationProperty
    private final Platform platform = new Platform();

    @NestedConfigurationProperty
    private final Delivery delivery = new Delivery();

    @NestedConfigurationProperty
    private final Replies replies = new Replies();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Phone getPhone() {
        return phone;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public Platform getPlatform() {
        return platform;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Replies getReplies() {
        return replies;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the orchestrator.
         */
        private String keyPrefix = "orchestrator";

        /**
         * Time-to-live of the per-conversation message history.
         */
        private Duration messageTtl = Duration.ofDays(7);

        /**
         * How long a processed gateway message id is remembered for duplicate suppression.
         */
        private Duration dedupTtl = Duration.ofMinutes(10);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getMessageTtl() {
            return messageTtl;
        }

        public void setMessageTtl(Duration messageTtl) {
            this.messageTtl = messageTtl;
        }

        public Duration getDedupTtl() {
            return dedupTtl;
        }

        public void setDedupTtl(Duration dedupTtl) {
            this.dedupTtl = dedupTtl;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic to publish conversation lifecycle events.
         */
        private String lifecycleTopic = "orchestrator.lifecycle";

        /**
         * Kafka topic to publish recorded inbound and outbound messages.
         */
        private String messageTopic = "orchestrator.messages";

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public String getMessageTopic() {
            return messageTopic;
        }

        public void setMessageTopic(String messageTopic) {
            this.messageTopic = messageTopic;
        }
    }

    @Validated
    public static class Phone {

        /**
         * Country calling code used when converting between local and international number formats.
         */
        @NotBlank
        private String countryCode = "62";

        public String getCountryCode() {
            return countryCode;
        }

        public void setCountryCode(String countryCode) {
            this.countryCode = countryCode;
        }
    }

    @Validated
    public static class Gateway {

        /**
         * Base URL of the WhatsApp gateway API.
         */
        private String baseUrl = "http://localhost:7030";

        /**
         * Upper bound for a single send call.
         */
        private Duration timeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    @Validated
    public static class Platform {

        /**
         * Base URL of the dealership platform that executes staff operations.
         */
        private String baseUrl = "http://localhost:3000";

        /**
         * Path of the internal command endpoint.
         */
        private String commandPath = "/api/v1/internal/commands";

        /**
         * Shared secret sent as {@code X-Internal-Token}; omitted when blank.
         */
        private String internalToken;

        /**
         * Upper bound for a single operation call. Report generation can be slow.
         */
        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCommandPath() {
            return commandPath;
        }

        public void setCommandPath(String commandPath) {
            this.commandPath = commandPath;
        }

        public String getInternalToken() {
            return internalToken;
        }

        public void setInternalToken(String internalToken) {
            this.internalToken = internalToken;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    @Validated
    public static class Delivery {

        @NestedConfigurationProperty
        private final Retry retry = new Retry();

        public Retry getRetry() {
            return retry;
        }

        @Validated
        public static class Retry {

            /**
             * Total attempts per recipient, including the first. 1 disables retries.
             */
            @Min(1)
            private int maxAttempts = 1;

            /**
             * Delay before the first retry; later retries double it, with jitter.
             */
            private Duration initialBackoff = Duration.ofMillis(500);

            /**
             * Ceiling for the delay between two attempts.
             */
            private Duration maxBackoff = Duration.ofSeconds(5);

            public int getMaxAttempts() {
                return maxAttempts;
            }

            public void setMaxAttempts(int maxAttempts) {
                this.maxAttempts = maxAttempts;
            }

            public Duration getInitialBackoff() {
                return initialBackoff;
            }

            public void setInitialBackoff(Duration initialBackoff) {
                this.initialBackoff = initialBackoff;
            }

            public Duration getMaxBackoff() {
                return maxBackoff;
            }

            public void setMaxBackoff(Duration maxBackoff) {
                this.maxBackoff = maxBackoff;
            }
        }
    }

    /**
     * Fixed texts sent back to WhatsApp users.
     */
    @Validated
    public static class Replies {

        private String welcome =
                "Halo! Terima kasih telah menghubungi kami. Ada yang bisa kami bantu terkait mobil impian Anda?";

        private String handoff =
                "Terima kasih atas pertanyaannya. Tim sales kami akan segera membalas pesan Anda.";

        private String closing =
                "Terima kasih telah menghubungi kami. Percakapan ini kami tutup, silakan kirim pesan kapan saja jika butuh bantuan lagi.";

        private String unknownCommand =
                "Maaf, saya tidak mengerti command tersebut. Ketik \"help\" untuk daftar command yang tersedia.";

        private String staffHint =
                "Ketik \"help\" untuk melihat daftar command staff.";

        private String reportAccessDenied =
                "Maaf, fitur Laporan & Analitik hanya untuk Owner, Admin, dan Super Admin.";

        private String accessDenied =
                "Maaf, Anda tidak memiliki akses untuk command ini.";

        private String operationFailed =
                "Maaf, terjadi kendala saat memproses permintaan Anda. Silakan coba lagi beberapa saat lagi.";

        private String invalidCommand =
                "Format command belum lengkap: %s. Ketik \"help\" untuk contoh penggunaan.";

        private String verifyUsage =
                "Format verifikasi: /verify 08xxxxxxxxxx (nomor yang terdaftar sebagai staff).";

        private String verifySuccess =
                "Verifikasi berhasil. Nomor %s terhubung sebagai %s.";

        private String verifyFailed =
                "Nomor %s tidak terdaftar sebagai staff. Hubungi admin showroom Anda.";

        public String getWelcome() {
            return welcome;
        }

        public void setWelcome(String welcome) {
            this.welcome = welcome;
        }

        public String getHandoff() {
            return handoff;
        }

        public void setHandoff(String handoff) {
            this.handoff = handoff;
        }

        public String getClosing() {
            return closing;
        }

        public void setClosing(String closing) {
            this.closing = closing;
        }

        public String getUnknownCommand() {
            return unknownCommand;
        }

        public void setUnknownCommand(String unknownCommand) {
            this.unknownCommand = unknownCommand;
        }

        public String getStaffHint() {
            return staffHint;
        }

        public void setStaffHint(String staffHint) {
            this.staffHint = staffHint;
        }

        public String getReportAccessDenied() {
            return reportAccessDenied;
        }

        public void setReportAccessDenied(String reportAccessDenied) {
            this.reportAccessDenied = reportAccessDenied;
        }

        public String getAccessDenied() {
            return accessDenied;
        }

        public void setAccessDenied(String accessDenied) {
            this.accessDenied = accessDenied;
        }

        public String getOperationFailed() {
            return operationFailed;
        }

        public void setOperationFailed(String operationFailed) {
            this.operationFailed = operationFailed;
        }

        public String getInvalidCommand() {
            return invalidCommand;
        }

        public void setInvalidCommand(String invalidCommand) {
            this.invalidCommand = invalidCommand;
        }

        public String getVerifyUsage() {
            return verifyUsage;
        }

        public void setVerifyUsage(String verifyUsage) {
            this.verifyUsage = verifyUsage;
        }

        public String getVerifySuccess() {
            return verifySuccess;
        }

        public void setVerifySuccess(String verifySuccess) {
            this.verifySuccess = verifySuccess;
        }

        public String getVerifyFailed() {
            return verifyFailed;
        }

        public void setVerifyFailed(String verifyFailed) {
            this.verifyFailed = verifyFailed;
        }
    }
}
