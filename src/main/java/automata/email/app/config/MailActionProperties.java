package automata.email.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for mail action batches, bound from {@code mail.actions.*}.
 */
@Data
@ConfigurationProperties(prefix = "mail.actions")
public class MailActionProperties {
    /** Gmail user id the batches run against; "me" is the token owner. */
    private String userId = "me";

    /** Label added to every entity of a successful batch. Empty disables it. */
    private String processedLabel = "";

    /** Label removed from every entity of a successful batch. */
    private String unprocessedLabel = "unprocessed";

    /** Messages older than this are left out when a thread is expanded into messages. */
    private Duration maxMessageAge = Duration.ofDays(30);

    private String applicationName = "Mail Action Engine";
}
