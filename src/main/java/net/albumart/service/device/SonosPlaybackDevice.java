/**
 * Sonos zone player accessed over UPnP SOAP on its local HTTP port
 *
 * Features:
 * - Reads track metadata and position from AVTransport GetPositionInfo
 * - Reads the play/pause state from AVTransport GetTransportInfo
 * - Browses the ContentDirectory play queue ("Q:0") for upcoming entries
 * - Reads the room name once from the device description; on failure keeps the configured room
 * - Turns relative album art paths into absolute URLs on the player
 * - Every request is bounded by the configured device timeout
 */
package net.albumart.service.device;

import net.albumart.config.AlbumArtProperties;
import net.albumart.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class SonosPlaybackDevice implements PlaybackDevice {

    private static final Logger logger = LoggerFactory.getLogger(SonosPlaybackDevice.class);

    static final String SOURCE_NAME = "sonos";
    static final String AV_TRANSPORT_PATH = "/MediaRenderer/AVTransport/Control";
    static final String CONTENT_DIRECTORY_PATH = "/MediaServer/ContentDirectory/Control";
    static final String DEVICE_DESCRIPTION_PATH = "/xml/device_description.xml";

    private static final String AV_TRANSPORT_SERVICE = "urn:schemas-upnp-org:service:AVTransport:1";
    private static final String CONTENT_DIRECTORY_SERVICE = "urn:schemas-upnp-org:service:ContentDirectory:1";
    private static final String QUEUE_OBJECT_ID = "Q:0";
    private static final String BROWSE_FILTER = "dc:title,res,dc:creator,upnp:artist,upnp:album,upnp:albumArtURI";
    private static final MediaType SOAP_CONTENT_TYPE = MediaType.parseMediaType("text/xml; charset=\"utf-8\"");

    private final WebClient webClient;
    private final String host;
    private final String baseUrl;
    private final Duration timeout;
    private final String configuredRoom;
    private final AtomicReference<String> roomName = new AtomicReference<>();

    public SonosPlaybackDevice(WebClient.Builder webClientBuilder, AlbumArtProperties properties) {
        AlbumArtProperties.Device device = properties.getDevice();
        this.host = device.getHost() == null ? "" : device.getHost().trim();
        this.baseUrl = "http://" + host + ":" + device.getPort();
        this.timeout = device.getTimeout();
        this.configuredRoom = device.getRoom();
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
    }

    @Override
    public String name() {
        return SOURCE_NAME;
    }

    @Override
    public boolean isAvailable() {
        return StringUtils.hasText(host);
    }

    @Override
    public Optional<DevicePlaybackInfo> queryPlayback() throws DeviceQueryException {
        if (!isAvailable()) {
            return Optional.empty();
        }
        Document position = SonosXml.parse(soapCall(AV_TRANSPORT_PATH, AV_TRANSPORT_SERVICE, "GetPositionInfo",
            "<InstanceID>0</InstanceID>"));
        Document transport = SonosXml.parse(soapCall(AV_TRANSPORT_PATH, AV_TRANSPORT_SERVICE, "GetTransportInfo",
            "<InstanceID>0</InstanceID>"));

        String metadata = SonosXml.firstText(position, "TrackMetaData");
        if (SonosXml.isMissing(metadata)) {
            return Optional.empty();
        }
        Element item = SonosXml.firstElement(SonosXml.parse(metadata), "item");
        if (item == null) {
            return Optional.empty();
        }

        String title = SonosXml.firstText(item, "title");
        if (!StringUtils.hasText(title)) {
            return Optional.empty();
        }

        boolean playing = "PLAYING".equals(SonosXml.firstText(transport, "CurrentTransportState"));
        return Optional.of(new DevicePlaybackInfo(
            title,
            artistOf(item),
            SonosXml.firstText(item, "album"),
            absoluteArtUrl(SonosXml.firstText(item, "albumArtURI")),
            SonosTimeParser.toMillis(SonosXml.firstText(position, "RelTime")),
            SonosTimeParser.toMillis(SonosXml.firstText(position, "TrackDuration")),
            playing,
            resolveRoomName(),
            parseTrackNumber(SonosXml.firstText(position, "Track"))
        ));
    }

    @Override
    public List<DeviceQueueEntry> queryUpcomingQueue(int currentPosition, int limit) throws DeviceQueryException {
        if (!isAvailable() || currentPosition <= 0 || limit <= 0) {
            return List.of();
        }
        // The 1-based position of the current track is the 0-based index of the next one
        String body = "<ObjectID>" + QUEUE_OBJECT_ID + "</ObjectID>"
            + "<BrowseFlag>BrowseDirectChildren</BrowseFlag>"
            + "<Filter>" + SonosXml.escape(BROWSE_FILTER) + "</Filter>"
            + "<StartingIndex>" + currentPosition + "</StartingIndex>"
            + "<RequestedCount>" + limit + "</RequestedCount>"
            + "<SortCriteria></SortCriteria>";
        Document response = SonosXml.parse(soapCall(CONTENT_DIRECTORY_PATH, CONTENT_DIRECTORY_SERVICE, "Browse", body));

        String didl = SonosXml.firstText(response, "Result");
        if (SonosXml.isMissing(didl)) {
            return List.of();
        }

        List<DeviceQueueEntry> entries = new ArrayList<>();
        for (Element item : SonosXml.elements(SonosXml.parse(didl), "item")) {
            if (entries.size() >= limit) {
                break;
            }
            entries.add(new DeviceQueueEntry(
                SonosXml.firstText(item, "title"),
                artistOf(item),
                SonosXml.firstText(item, "album"),
                absoluteArtUrl(SonosXml.firstText(item, "albumArtURI"))
            ));
        }
        return entries;
    }

    @Override
    public void close() {
        roomName.set(null);
        logger.info("Released Sonos device {}", baseUrl);
    }

    String absoluteArtUrl(String artUrl) {
        if (SonosXml.isMissing(artUrl)) {
            return null;
        }
        String trimmed = artUrl.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return baseUrl + (trimmed.startsWith("/") ? trimmed : "/" + trimmed);
    }

    private String resolveRoomName() {
        String cached = roomName.get();
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }
        String resolved = configuredRoom == null ? "" : configuredRoom.trim();
        try {
            String description = webClient.get()
                .uri(DEVICE_DESCRIPTION_PATH)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
            String reported = SonosXml.firstText(SonosXml.parse(description), "roomName");
            if (StringUtils.hasText(reported)) {
                resolved = reported;
            }
        } catch (WebClientException | IllegalStateException | DeviceQueryException e) {
            // Fallback is kept until close(); the description is not re-read on every poll
            logger.info("Could not read Sonos room name from {}; using configured room '{}': {}",
                baseUrl, resolved, e.getMessage());
        }
        roomName.compareAndSet(null, resolved);
        return StringUtils.hasText(resolved) ? resolved : null;
    }

    private String soapCall(String path, String service, String action, String arguments) throws DeviceQueryException {
        String envelope = "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<s:Envelope xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\""
            + " s:encodingStyle=\"http://schemas.xmlsoap.org/soap/encoding/\">"
            + "<s:Body><u:" + action + " xmlns:u=\"" + service + "\">"
            + arguments
            + "</u:" + action + "></s:Body></s:Envelope>";
        ExternalApiLogger.logApiCallAttempt(logger, "Sonos", action, baseUrl);
        try {
            String response = webClient.post()
                .uri(path)
                .contentType(SOAP_CONTENT_TYPE)
                .header("SOAPACTION", "\"" + service + "#" + action + "\"")
                .bodyValue(envelope)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
            if (response == null) {
                throw new DeviceQueryException("Empty " + action + " response from " + baseUrl);
            }
            return response;
        } catch (WebClientException | IllegalStateException e) {
            // WebClientException: HTTP errors or connection issues; IllegalStateException: timeout from block()
            throw new DeviceQueryException(action + " failed against " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private static String artistOf(Element item) {
        String creator = SonosXml.firstText(item, "creator");
        return StringUtils.hasText(creator) ? creator : SonosXml.firstText(item, "artist");
    }

    private static int parseTrackNumber(String value) {
        if (!StringUtils.hasText(value)) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
