package app.fsidrill.srs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.srs.storage")
public record StorageProps(
        StorageType type,
        String directory,
        String cardsKey,
        String analyticsKey,
        Duration drainTimeout
) {
    public StorageProps {
        if (type == null) type = StorageType.FILE;
        if (directory == null || directory.isBlank()) directory = "./data";
        if (cardsKey == null || cardsKey.isBlank()) cardsKey = "allonsy_fsi_srs";
        if (analyticsKey == null || analyticsKey.isBlank()) analyticsKey = "allonsy_fsi_analytics";
        if (drainTimeout == null || drainTimeout.isNegative()) drainTimeout = Duration.ofSeconds(10);
    }

    public static StorageProps inMemory() {
        return new StorageProps(StorageType.MEMORY, null, null, null, null);
    }

    public enum StorageType {
        MEMORY, FILE
    }
}
