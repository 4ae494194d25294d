package net.albumart.service.artwork;

import net.albumart.util.MetadataNormalizer;

/**
 * Artwork cache key: the normalized (artist, album) pair. Never keyed on artist alone.
 */
public record ArtworkKey(String artist, String album) {

    public ArtworkKey {
        artist = MetadataNormalizer.normalize(artist);
        album = MetadataNormalizer.normalize(album);
    }

    public static ArtworkKey of(String artist, String album) {
        return new ArtworkKey(artist, album);
    }

    @Override
    public String toString() {
        return artist + "|" + album;
    }
}
