package net.albumart.service.artwork;

/**
 * External artwork lookup keyed on artist and album.
 */
public interface ArtworkLookupClient {

    /**
     * Looks up artwork for the given pair.
     *
     * @param artist query artist
     * @param album query album
     * @param maxImageSize requested edge length in pixels
     * @return zero-or-one candidate, a rate-limit signal, or an error; never throws
     */
    ArtworkLookupResult lookup(String artist, String album, int maxImageSize);

    /**
     * Short name used in logs and diagnostics.
     */
    String name();
}
