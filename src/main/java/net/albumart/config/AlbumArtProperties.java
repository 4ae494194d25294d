package net.albumart.config;

import jakarta.annotation.PostConstruct;
import net.albumart.model.DisplayMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * Strongly typed configuration for polling, artwork resolution and streaming.
 * Bound once at startup; nothing re-reads it while the application runs.
 */
@Component
@ConfigurationProperties(prefix = "album-art")
public class AlbumArtProperties {

    private final Polling polling = new Polling();
    private final Device device = new Device();
    private final Artwork artwork = new Artwork();
    private final Queue queue = new Queue();
    private final Stream stream = new Stream();
    private final Display display = new Display();

    @PostConstruct
    void validate() {
        Assert.isTrue(polling.interval.toMillis() > 0, "album-art.polling.interval must be positive");
        Assert.isTrue(polling.graceCycles >= 1, "album-art.polling.grace-cycles must be at least 1");
        Assert.isTrue(device.port > 0 && device.port <= 65535, "album-art.device.port must be a valid TCP port");
        Assert.isTrue(device.timeout.toMillis() > 0, "album-art.device.timeout must be positive");
        Assert.isTrue(artwork.maxImageSize >= 100 && artwork.maxImageSize <= 3000,
                "album-art.artwork.max-image-size must be between 100 and 3000");
        Assert.isTrue(!artwork.cooldown.isNegative(), "album-art.artwork.cooldown must be non-negative");
        Assert.isTrue(artwork.lookupTimeout.toMillis() > 0, "album-art.artwork.lookup-timeout must be positive");
        Assert.isTrue(artwork.requestsPerMinute > 0, "album-art.artwork.requests-per-minute must be positive");
        Assert.isTrue(artwork.cacheMaximumSize > 0, "album-art.artwork.cache-maximum-size must be positive");
        Assert.isTrue(queue.lookahead >= 0 && queue.lookahead <= 20, "album-art.queue.lookahead must be between 0 and 20");
        Assert.isTrue(stream.heartbeatInterval.toMillis() > 0, "album-art.stream.heartbeat-interval must be positive");
        Assert.isTrue(DisplayMode.fromWireValue(display.defaultMode).isPresent(),
                "album-art.display.default-mode must be one of on, detailed, comparison, debug, off");
    }

    public Polling getPolling() {
        return polling;
    }

    public Device getDevice() {
        return device;
    }

    public Artwork getArtwork() {
        return artwork;
    }

    public Queue getQueue() {
        return queue;
    }

    public Stream getStream() {
        return stream;
    }

    public Display getDisplay() {
        return display;
    }

    public static class Polling {

        /**
         * Whether the device poll loop starts with the application.
         */
        private boolean enabled = true;

        /**
         * Fixed delay between two device polls.
         */
        private Duration interval = Duration.ofSeconds(3);

        /**
         * Consecutive failed polls tolerated before publishing "nothing playing".
         */
        private int graceCycles = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getGraceCycles() {
            return graceCycles;
        }

        public void setGraceCycles(int graceCycles) {
            this.graceCycles = graceCycles;
        }
    }

    public static class Device {

        /**
         * Host name or IP address of the Sonos zone player.
         */
        private String host = "";

        private int port = 1400;

        /**
         * Upper bound for each device request.
         */
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Room name to report when the device description does not provide one.
         */
        private String room = "";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getRoom() {
            return room;
        }

        public void setRoom(String room) {
            this.room = room;
        }
    }

    public static class Artwork {

        /**
         * Whether higher resolution artwork is looked up externally.
         */
        private boolean externalLookupEnabled = true;

        /**
         * Edge length in pixels requested from the lookup service.
         */
        private int maxImageSize = 1200;

        /**
         * How long external lookups are skipped after a rate-limit rejection.
         */
        private Duration cooldown = Duration.ofSeconds(60);

        private Duration lookupTimeout = Duration.ofSeconds(5);

        private String searchUrl = "https://itunes.apple.com/search";

        /**
         * Client-side request budget, kept below the public iTunes Search allowance.
         */
        private int requestsPerMinute = 20;

        private int cacheMaximumSize = 10_000;

        public boolean isExternalLookupEnabled() {
            return externalLookupEnabled;
        }

        public void setExternalLookupEnabled(boolean externalLookupEnabled) {
            this.externalLookupEnabled = externalLookupEnabled;
        }

        public int getMaxImageSize() {
            return maxImageSize;
        }

        public void setMaxImageSize(int maxImageSize) {
            this.maxImageSize = maxImageSize;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public Duration getLookupTimeout() {
            return lookupTimeout;
        }

        public void setLookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = lookupTimeout;
        }

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public int getCacheMaximumSize() {
            return cacheMaximumSize;
        }

        public void setCacheMaximumSize(int cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
        }
    }

    public static class Queue {

        /**
         * Number of upcoming queue entries resolved and published.
         */
        private int lookahead = 5;

        public int getLookahead() {
            return lookahead;
        }

        public void setLookahead(int lookahead) {
            this.lookahead = lookahead;
        }
    }

    public static class Stream {

        /**
         * Keepalive period; must stay below proxy and client read timeouts.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(15);

        /**
         * Lifetime of one SSE response before the client is asked to reconnect.
         */
        private Duration emitterTimeout = Duration.ofHours(1);

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getEmitterTimeout() {
            return emitterTimeout;
        }

        public void setEmitterTimeout(Duration emitterTimeout) {
            this.emitterTimeout = emitterTimeout;
        }
    }

    public static class Display {

        private String defaultMode = "on";

        public String getDefaultMode() {
            return defaultMode;
        }

        public void setDefaultMode(String defaultMode) {
            this.defaultMode = defaultMode;
        }
    }
}
