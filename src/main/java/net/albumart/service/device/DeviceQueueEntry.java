package net.albumart.service.device;

/**
 * One upcoming entry from the device's play queue.
 */
public record DeviceQueueEntry(String title, String artist, String album, String nativeArtUrl) {

    public DeviceQueueEntry {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
    }
}
