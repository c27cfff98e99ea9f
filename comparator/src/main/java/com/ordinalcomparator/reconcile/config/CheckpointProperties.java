package com.ordinalcomparator.reconcile.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where checkpoints live. FILE keeps one JSON document per checkpoint key in {@code directory};
 * MONGO keeps one document per key in {@code mongoDatabase}.
 */
@ConfigurationProperties(prefix = "comparator.checkpoint")
@NoArgsConstructor
@Getter
@Setter
public class CheckpointProperties {

    private StoreType type = StoreType.FILE;

    private String directory = ".comparator/checkpoints";

    private String mongoUri = "mongodb://localhost:27017";

    private String mongoDatabase = "ordinal_comparator";

    public enum StoreType {
        FILE,
        MONGO
    }
}
