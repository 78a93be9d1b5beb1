package com.github.rudygunawan.rendercache.example;

import com.github.rudygunawan.rendercache.api.ByteSizer;
import com.github.rudygunawan.rendercache.api.RenderCache;
import com.github.rudygunawan.rendercache.builder.RenderCacheBuilder;
import com.github.rudygunawan.rendercache.metrics.MicrometerRenderCacheMetrics;
import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheItemMetadata;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.github.rudygunawan.rendercache.model.CacheWarmupResult;
import com.github.rudygunawan.rendercache.model.FileChangeEvent;
import com.github.rudygunawan.rendercache.model.WarmupEntry;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Example of a documentation server's render path:
 * - Rendering through the cache
 * - Invalidating when the watcher reports a changed file
 * - Warming up, inspecting entries and reading statistics
 */
public class RenderCacheExample {

    public static void main(String[] args) {
        System.out.println("=== Render Cache Example ===\n");

        MeterRegistry registry = new SimpleMeterRegistry();
        try (RenderCache<String> cache = RenderCacheBuilder.newBuilder()
                .maxEntries(500)
                .maxTotalBytes(5 * 1024 * 1024)
                .ttl(10, TimeUnit.MINUTES)
                .byteSizer(ByteSizer.utf8Sizer())
                .cleanupInterval(1, TimeUnit.MINUTES)
                .listener(event -> System.out.println("  removed " + event.getKeys().size()
                        + " entries (" + event.getReason() + ")"))
                .<String>build()) {

            MicrometerRenderCacheMetrics.monitor(registry, cache, "markdown");

            String markdown = "# Getting started\n\nInstall the server and open a folder.";
            CacheKeyParams params = CacheKeyParams.builder(markdown)
                    .filePath("docs/getting-started.md")
                    .option("toc", true)
                    .theme("light")
                    .build();

            System.out.println("Rendering twice...");
            cache.getOrCompute(params, 1_000L, () -> render(markdown));
            cache.getOrCompute(params, 1_000L, () -> render(markdown));
            System.out.println("Statistics: " + cache.statistics());

            System.out.println("\nFile saved with the same mtime:");
            cache.onFileChange(FileChangeEvent.changed("docs/getting-started.md", 1_000L));
            System.out.println("  entries: " + cache.size());

            System.out.println("File edited:");
            cache.onFileChange(FileChangeEvent.changed("docs/getting-started.md", 2_000L));
            System.out.println("  entries: " + cache.size());

            System.out.println("\n=== Warmup ===");
            List<WarmupEntry<String>> pages = new ArrayList<>();
            for (int i = 1; i <= 3; i++) {
                String source = "# Chapter " + i;
                pages.add(new WarmupEntry<>(CacheKeyParams.of(source, "docs/chapter-" + i + ".md"), 1_000L,
                        () -> render(source)));
            }
            CacheWarmupResult warmup = cache.warmup(pages);
            System.out.println(warmup);

            System.out.println("\n=== Entries ===");
            for (CacheItemMetadata item : cache.entries()) {
                System.out.println("  " + item.getFilePath() + ": " + item.getSize() + " bytes, ttl "
                        + item.getRemainingTtl() + " ms");
            }

            CacheHealthStatus health = cache.healthStatus();
            System.out.println("\nHealthy: " + health.isHealthy() + ", warnings: " + health.getWarnings());
            System.out.println("cache.size gauge: " + registry.find("cache.size").gauge().value());
        }

        System.out.println("\n=== Example Complete ===");
    }

    private static String render(String markdown) {
        return "<article>" + markdown.replace("# ", "<h1>") + "</article>";
    }
}
