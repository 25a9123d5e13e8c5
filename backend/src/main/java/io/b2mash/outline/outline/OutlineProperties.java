package io.b2mash.outline.outline;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning for the outline read model.
 *
 * @param forestCacheMaxSize number of memoized forests kept across templates
 * @param snapshotTtl how long a cached flat task list is served before it is reloaded
 * @param backendThreads worker threads executing store calls
 */
@ConfigurationProperties(prefix = "outline")
public record OutlineProperties(
    @DefaultValue("500") int forestCacheMaxSize,
    @DefaultValue("10m") Duration snapshotTtl,
    @DefaultValue("4") int backendThreads) {}
