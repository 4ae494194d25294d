package net.albumart.service.device;

/**
 * Raw playback state as reported by the device, before artwork resolution.
 *
 * @param title track title, empty when the device reports nothing
 * @param artist reported artist, may be empty
 * @param album reported album, may be empty
 * @param nativeArtUrl absolute URL of the device's own artwork, or {@code null}
 * @param positionMs playback position, 0 when unknown
 * @param durationMs track duration, 0 when unknown
 * @param playing whether the transport state is PLAYING
 * @param roomName room the device belongs to, or {@code null}
 * @param queuePosition 1-based position of the track in the play queue, 0 when not playing from the queue
 */
public record DevicePlaybackInfo(
    String title,
    String artist,
    String album,
    String nativeArtUrl,
    long positionMs,
    long durationMs,
    boolean playing,
    String roomName,
    int queuePosition
) {

    public DevicePlaybackInfo {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
        positionMs = Math.max(0L, positionMs);
        durationMs = Math.max(0L, durationMs);
        queuePosition = Math.max(0, queuePosition);
    }

    /**
     * A report without a title carries nothing to display.
     */
    public boolean hasTrack() {
        return !title.isBlank();
    }
}
