package net.albumart.service.artwork;

/**
 * Candidate returned by the external lookup, with the artist and album the service reports
 * for it (which may differ from the query).
 */
public record ArtworkCandidate(
    String artist,
    String album,
    String imageUrl,
    int width,
    int height
) {}
