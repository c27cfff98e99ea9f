package com.ordinalcomparator.reconcile.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "comparator.report")
@NoArgsConstructor
@Getter
@Setter
public class ReportProperties {

    /** Optional JSON Lines report file. Divergent and unverified blocks plus the run summary are appended. */
    private String file;
}
