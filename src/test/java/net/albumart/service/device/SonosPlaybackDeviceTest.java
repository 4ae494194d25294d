package net.albumart.service.device;

import net.albumart.config.AlbumArtProperties;
import net.albumart.testutil.StubExchanges;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SonosPlaybackDeviceTest {

    private static final String XML = "text/xml; charset=\"utf-8\"";

    private static final String TRACK_DIDL = "<DIDL-Lite xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
        + " xmlns:upnp=\"urn:schemas-upnp-org:metadata-1-0/upnp/\""
        + " xmlns:r=\"urn:schemas-rinconnetworks-com:metadata-1-0/\""
        + " xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\">"
        + "<item id=\"-1\" parentID=\"-1\" restricted=\"true\">"
        + "<res protocolInfo=\"sonos.com-spotify:*:audio/x-spotify:*\" duration=\"0:03:25\">x-sonos-spotify:track</res>"
        + "<upnp:albumArtURI>/getaa?s=1&amp;u=x-sonos-spotify%3atrack</upnp:albumArtURI>"
        + "<dc:title>Another Brick in the Wall, Pt. 2</dc:title>"
        + "<upnp:class>object.item.audioItem.musicTrack</upnp:class>"
        + "<dc:creator>Pink Floyd</dc:creator>"
        + "<upnp:album>The Wall</upnp:album>"
        + "</item></DIDL-Lite>";

    private static final String QUEUE_DIDL = "<DIDL-Lite xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
        + " xmlns:upnp=\"urn:schemas-upnp-org:metadata-1-0/upnp/\""
        + " xmlns=\"urn:schemas-upnp-org:metadata-1-0/DIDL-Lite/\">"
        + "<item id=\"Q:0/4\" parentID=\"Q:0\"><dc:title>Mother</dc:title><dc:creator>Pink Floyd</dc:creator>"
        + "<upnp:album>The Wall</upnp:album><upnp:albumArtURI>/getaa?s=1&amp;u=mother</upnp:albumArtURI></item>"
        + "<item id=\"Q:0/5\" parentID=\"Q:0\"><dc:title>Paranoid Android</dc:title><dc:creator>Radiohead</dc:creator>"
        + "<upnp:album>OK Computer</upnp:album><upnp:albumArtURI>https://i.scdn.co/image/ok.jpg</upnp:albumArtURI></item>"
        + "</DIDL-Lite>";

    private AlbumArtProperties properties;
    private String transportState;
    private String positionMetadata;

    @BeforeEach
    void setUp() {
        properties = new AlbumArtProperties();
        properties.getDevice().setHost("192.168.1.20");
        properties.getDevice().setTimeout(Duration.ofMillis(500));
        transportState = "PLAYING";
        positionMetadata = TRACK_DIDL;
    }

    private SonosPlaybackDevice device(StubExchanges.Recording exchange) {
        return new SonosPlaybackDevice(WebClient.builder().exchangeFunction(exchange), properties);
    }

    private StubExchanges.Recording speaker() {
        return new StubExchanges.Recording(request -> Mono.just(answer(request)));
    }

    private ClientResponse answer(ClientRequest request) {
        String path = request.url().getPath();
        String action = request.headers().getFirst("SOAPACTION");
        if (SonosPlaybackDevice.DEVICE_DESCRIPTION_PATH.equals(path)) {
            return StubExchanges.response(HttpStatus.OK, XML,
                "<root xmlns=\"urn:schemas-upnp-org:device-1-0\"><device><roomName>Living Room</roomName></device></root>");
        }
        if (action != null && action.contains("#GetPositionInfo")) {
            return StubExchanges.response(HttpStatus.OK, XML, envelope("GetPositionInfoResponse",
                "<Track>3</Track><TrackDuration>0:03:25</TrackDuration>"
                    + "<TrackMetaData>" + escape(positionMetadata) + "</TrackMetaData>"
                    + "<TrackURI>x-sonos-spotify:track</TrackURI><RelTime>0:01:02</RelTime>"));
        }
        if (action != null && action.contains("#GetTransportInfo")) {
            return StubExchanges.response(HttpStatus.OK, XML, envelope("GetTransportInfoResponse",
                "<CurrentTransportState>" + transportState + "</CurrentTransportState>"
                    + "<CurrentTransportStatus>OK</CurrentTransportStatus>"));
        }
        if (action != null && action.contains("#Browse")) {
            return StubExchanges.response(HttpStatus.OK, XML, envelope("BrowseResponse",
                "<Result>" + escape(QUEUE_DIDL) + "</Result><NumberReturned>2</NumberReturned>"));
        }
        return StubExchanges.response(HttpStatus.NOT_FOUND, "text/plain", "unknown");
    }

    private static String envelope(String responseElement, String content) {
        return "<s:Envelope xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\"><s:Body>"
            + "<u:" + responseElement + " xmlns:u=\"urn:schemas-upnp-org:service:AVTransport:1\">"
            + content
            + "</u:" + responseElement + "></s:Body></s:Envelope>";
    }

    private static String escape(String xml) {
        return xml.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    @Test
    void should_ReadTrackMetadata_When_SpeakerIsPlaying() throws Exception {
        Optional<DevicePlaybackInfo> playback = device(speaker()).queryPlayback();

        assertThat(playback).hasValueSatisfying(info -> {
            assertThat(info.title()).isEqualTo("Another Brick in the Wall, Pt. 2");
            assertThat(info.artist()).isEqualTo("Pink Floyd");
            assertThat(info.album()).isEqualTo("The Wall");
            assertThat(info.playing()).isTrue();
            assertThat(info.positionMs()).isEqualTo(62_000L);
            assertThat(info.durationMs()).isEqualTo(205_000L);
            assertThat(info.roomName()).isEqualTo("Living Room");
            assertThat(info.queuePosition()).isEqualTo(3);
        });
    }

    @Test
    void should_MakeArtUrlAbsolute_When_SpeakerReportsRelativePath() throws Exception {
        DevicePlaybackInfo info = device(speaker()).queryPlayback().orElseThrow();

        assertThat(info.nativeArtUrl()).isEqualTo("http://192.168.1.20:1400/getaa?s=1&u=x-sonos-spotify%3atrack");
    }

    @Test
    void should_ReportNotPlaying_When_TransportPaused() throws Exception {
        transportState = "PAUSED_PLAYBACK";

        DevicePlaybackInfo info = device(speaker()).queryPlayback().orElseThrow();

        assertThat(info.playing()).isFalse();
    }

    @Test
    void should_ReportNothing_When_MetadataNotImplemented() throws Exception {
        positionMetadata = "NOT_IMPLEMENTED";

        assertThat(device(speaker()).queryPlayback()).isEmpty();
    }

    @Test
    void should_SendSoapActionHeader_When_QueryingTransport() throws Exception {
        StubExchanges.Recording exchange = speaker();

        device(exchange).queryPlayback();

        ClientRequest first = exchange.requests().get(0);
        assertThat(first.url().getPath()).isEqualTo(SonosPlaybackDevice.AV_TRANSPORT_PATH);
        assertThat(first.headers().getFirst("SOAPACTION"))
            .isEqualTo("\"urn:schemas-upnp-org:service:AVTransport:1#GetPositionInfo\"");
    }

    @Test
    void should_ReadEntriesAfterCurrentTrack_When_BrowsingQueue() throws Exception {
        StubExchanges.Recording exchange = speaker();

        List<DeviceQueueEntry> entries = device(exchange).queryUpcomingQueue(3, 5);

        assertThat(entries).extracting(DeviceQueueEntry::title).containsExactly("Mother", "Paranoid Android");
        assertThat(entries.get(0).nativeArtUrl()).isEqualTo("http://192.168.1.20:1400/getaa?s=1&u=mother");
        assertThat(entries.get(1).nativeArtUrl()).isEqualTo("https://i.scdn.co/image/ok.jpg");
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo(SonosPlaybackDevice.CONTENT_DIRECTORY_PATH);
    }

    @Test
    void should_TruncateQueue_When_SpeakerReturnsMoreThanLimit() throws Exception {
        List<DeviceQueueEntry> entries = device(speaker()).queryUpcomingQueue(3, 1);

        assertThat(entries).extracting(DeviceQueueEntry::title).containsExactly("Mother");
    }

    @Test
    void should_SkipQueueBrowse_When_TrackIsNotFromQueue() throws Exception {
        StubExchanges.Recording exchange = speaker();

        assertThat(device(exchange).queryUpcomingQueue(0, 5)).isEmpty();
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void should_ThrowDeviceQueryException_When_SpeakerUnreachable() {
        StubExchanges.Recording exchange = new StubExchanges.Recording(request -> Mono.never());

        assertThatThrownBy(() -> device(exchange).queryPlayback())
            .isInstanceOf(DeviceQueryException.class)
            .hasMessageContaining("GetPositionInfo");
    }

    @Test
    void should_ThrowDeviceQueryException_When_ResponseIsNotXml() {
        StubExchanges.Recording exchange = new StubExchanges.Recording(request ->
            Mono.just(StubExchanges.response(HttpStatus.OK, XML, "not xml at all")));

        assertThatThrownBy(() -> device(exchange).queryPlayback())
            .isInstanceOf(DeviceQueryException.class);
    }

    @Test
    void should_NotContactSpeaker_When_HostNotConfigured() throws Exception {
        properties.getDevice().setHost("");
        StubExchanges.Recording exchange = speaker();
        SonosPlaybackDevice device = device(exchange);

        assertThat(device.isAvailable()).isFalse();
        assertThat(device.queryPlayback()).isEmpty();
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void should_FallBackToConfiguredRoom_When_DescriptionUnavailable() throws Exception {
        properties.getDevice().setRoom("Kitchen");
        StubExchanges.Recording exchange = new StubExchanges.Recording(request ->
            SonosPlaybackDevice.DEVICE_DESCRIPTION_PATH.equals(request.url().getPath())
                ? Mono.just(StubExchanges.response(HttpStatus.INTERNAL_SERVER_ERROR, "text/plain", "boom"))
                : Mono.just(answer(request)));

        DevicePlaybackInfo info = device(exchange).queryPlayback().orElseThrow();

        assertThat(info.roomName()).isEqualTo("Kitchen");
    }

    @Test
    void should_ReadDescriptionOnce_When_FirstAttemptFails() throws Exception {
        properties.getDevice().setRoom("Kitchen");
        StubExchanges.Recording exchange = new StubExchanges.Recording(request ->
            SonosPlaybackDevice.DEVICE_DESCRIPTION_PATH.equals(request.url().getPath())
                ? Mono.never()
                : Mono.just(answer(request)));
        SonosPlaybackDevice device = device(exchange);

        DevicePlaybackInfo first = device.queryPlayback().orElseThrow();
        DevicePlaybackInfo second = device.queryPlayback().orElseThrow();

        assertThat(first.roomName()).isEqualTo("Kitchen");
        assertThat(second.roomName()).isEqualTo("Kitchen");
        assertThat(exchange.requests())
            .filteredOn(request -> SonosPlaybackDevice.DEVICE_DESCRIPTION_PATH.equals(request.url().getPath()))
            .hasSize(1);
    }
}
