package org.pokernight.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {
    /** Rounding residue accepted per player before a ledger counts as unbalanced. */
    private long roundingTolerancePerPlayerCents = 1;

    /** How long a caller waits for another caller's in-flight settlement. */
    private Duration waitTimeout = Duration.ofSeconds(5);

    private Duration pollInterval = Duration.ofMillis(50);

    /** A SETTLING claim older than this is considered abandoned and may be reclaimed. */
    private Duration staleClaimAfter = Duration.ofSeconds(30);
}
