package com.tempmail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * TempMail configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "tempmail")
public class ServerProperties {

    /** Accepted mail domains, comma or whitespace separated */
    private String domains = "temp.example.com";
    private String hostname = "mx.temp.example.com";
    private String subjectPlaceholder = "(no subject)";

    public List<String> getDomainList() {
        if (domains == null || domains.isBlank()) {
            return List.of();
        }
        return Arrays.stream(domains.split("[,\\s]+"))
                .map(String::trim)
                .filter(d -> !d.isEmpty())
                .map(d -> d.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isLocalDomain(String domain) {
        return domain != null && getDomainList().contains(domain.toLowerCase(Locale.ROOT));
    }

    private Smtp smtp = new Smtp();
    private Storage storage = new Storage();
    private Retention retention = new Retention();
    private Forward forward = new Forward();
    private Queue queue = new Queue();

    @Data
    public static class Smtp {
        private int port = 2525;
        private long maxMessageSize = 26214400L; // 25MB
        private int maxRecipients = 100;
        private long timeout = 300000L;
        private String banner = "TempMail ESMTP Ready";
    }

    @Data
    public static class Storage {
        private String basePath = "data/eml";

        /**
         * Label recorded with every archived message
         */
        private String bucket = "mail-eml";
    }

    @Data
    public static class Retention {
        private int minutes = 30;
        private long sweepIntervalMs = 60000L;
        private long sweepInitialDelayMs = 60000L;
    }

    @Data
    public static class Forward {
        /** Empty means deliver by MX lookup of the target domain */
        private String relayHost = "";
        private int relayPort = 25;
        private List<Rule> rules = new ArrayList<>();

        @Data
        public static class Rule {
            /** Local-part prefix, or "*" for every local part */
            private String prefix;
            private String target;
        }
    }

    @Data
    public static class Queue {
        private String inboundDestination = "mail.inbound.queue";
        /** Listener consumers, "lower-upper" */
        private String concurrency = "1-5";
    }
}
