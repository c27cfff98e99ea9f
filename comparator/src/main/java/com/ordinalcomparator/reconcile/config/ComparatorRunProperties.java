package com.ordinalcomparator.reconcile.config;

import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.RunConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * What to compare. Command-line flags ({@code --primary-endpoint}, {@code --chain}, ...) are mapped onto
 * these properties in application.yml.
 */
@ConfigurationProperties(prefix = "comparator")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ComparatorRunProperties {

    /** URL of the primary (reference) indexer. */
    @NotBlank(message = "primary endpoint is required (--primary-endpoint)")
    private String primaryEndpoint;

    /** URL of the secondary indexer under verification. */
    @NotBlank(message = "secondary endpoint is required (--secondary-endpoint)")
    private String secondaryEndpoint;

    @NotNull(message = "chain is required (--chain BITCOIN|FRACTAL)")
    private ChainId chain;

    @NotNull(message = "protocol is required (--protocol ORDINAL|BRC20)")
    private ProtocolId protocol;

    /** Optional. Defaults to the first protocol-specific block of the chain. */
    @Min(0)
    private Long startBlock;

    /** Optional. Defaults to the latest block both endpoints have indexed. */
    @Min(0)
    private Long endBlock;

    /** Concurrent block workers. */
    @Min(1)
    private int threads = RunConfig.DEFAULT_THREAD_COUNT;

    public RunConfig toRunConfig() {
        return new RunConfig(
                chain,
                protocol,
                trimTrailingSlash(primaryEndpoint),
                trimTrailingSlash(secondaryEndpoint),
                startBlock,
                endBlock,
                threads);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
