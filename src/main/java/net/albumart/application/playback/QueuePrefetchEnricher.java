/**
 * Resolves artwork for the upcoming queue entries of one poll cycle
 *
 * Features:
 * - Fans out one resolution per entry on a pool bounded by the queue lookahead
 * - Each entry carries its own timeout; a slow or failing entry falls back to native art alone
 * - Joins on all entries before returning and preserves playback order
 * - Goes through the same resolver, cache and cooldown gate as the current track
 */
package net.albumart.application.playback;

import jakarta.annotation.PreDestroy;
import net.albumart.config.AlbumArtProperties;
import net.albumart.model.QueueItem;
import net.albumart.service.artwork.ArtworkResolution;
import net.albumart.service.artwork.ArtworkResolver;
import net.albumart.service.device.DeviceQueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class QueuePrefetchEnricher {

    private static final Logger logger = LoggerFactory.getLogger(QueuePrefetchEnricher.class);

    private final ArtworkResolver artworkResolver;
    private final int lookahead;
    private final Duration perEntryTimeout;
    private final ExecutorService executorService;

    @Autowired
    public QueuePrefetchEnricher(ArtworkResolver artworkResolver, AlbumArtProperties properties) {
        this(artworkResolver, properties.getQueue().getLookahead(), properties.getArtwork().getLookupTimeout());
    }

    QueuePrefetchEnricher(ArtworkResolver artworkResolver, int lookahead, Duration perEntryTimeout) {
        this.artworkResolver = artworkResolver;
        this.lookahead = Math.max(0, lookahead);
        this.perEntryTimeout = perEntryTimeout;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executorService = Executors.newFixedThreadPool(Math.max(1, this.lookahead), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("queue-prefetch-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int lookahead() {
        return lookahead;
    }

    /**
     * Resolves artwork for at most {@code lookahead} entries and waits for all of them.
     *
     * @param entries upcoming entries in playback order
     * @return one item per resolved entry, same order
     */
    public List<QueueItem> enrich(List<DeviceQueueEntry> entries) {
        if (entries == null || entries.isEmpty() || lookahead == 0) {
            return List.of();
        }
        List<DeviceQueueEntry> bounded = entries.subList(0, Math.min(entries.size(), lookahead));

        List<CompletableFuture<QueueItem>> futures = new ArrayList<>(bounded.size());
        for (DeviceQueueEntry entry : bounded) {
            futures.add(CompletableFuture
                .supplyAsync(() -> toQueueItem(entry, artworkResolver.resolve(entry.artist(), entry.album(), entry.nativeArtUrl())),
                    executorService)
                .orTimeout(perEntryTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    logger.debug("Queue artwork resolution failed for '{}' by '{}': {}",
                        entry.title(), entry.artist(), error.toString());
                    return toQueueItem(entry, ArtworkResolution.nativeArt(entry.nativeArtUrl(), ArtworkResolution.REASON_LOOKUP_ERROR));
                }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static QueueItem toQueueItem(DeviceQueueEntry entry, ArtworkResolution resolution) {
        return new QueueItem(
            entry.title(),
            entry.artist(),
            entry.album(),
            entry.nativeArtUrl(),
            resolution.displayUrl(),
            resolution.isExternal(),
            resolution.reason()
        );
    }

    @PreDestroy
    void shutdown() {
        executorService.shutdownNow();
    }
}
