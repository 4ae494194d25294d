package net.albumart.service.artwork;

/**
 * Outcome of a single external artwork lookup. Lookups never throw; every failure mode
 * is reported through {@link Status}.
 *
 * @param status outcome category
 * @param candidate the candidate for {@link Status#CANDIDATE}, otherwise {@code null}
 * @param detail diagnostic text for logs
 */
public record ArtworkLookupResult(Status status, ArtworkCandidate candidate, String detail) {

    public enum Status {
        /** The service returned a candidate; it still has to pass match validation. */
        CANDIDATE,
        /** The service answered with zero results. */
        NO_RESULT,
        /** The service rejected the call with a rate-limit response. */
        RATE_LIMITED,
        /** The local request budget is spent; the service was not contacted. */
        THROTTLED,
        /** Transport failure, timeout or malformed response. */
        ERROR
    }

    public static ArtworkLookupResult candidate(ArtworkCandidate candidate) {
        return new ArtworkLookupResult(Status.CANDIDATE, candidate, null);
    }

    public static ArtworkLookupResult noResult() {
        return new ArtworkLookupResult(Status.NO_RESULT, null, null);
    }

    public static ArtworkLookupResult rateLimited(String detail) {
        return new ArtworkLookupResult(Status.RATE_LIMITED, null, detail);
    }

    public static ArtworkLookupResult throttled(String detail) {
        return new ArtworkLookupResult(Status.THROTTLED, null, detail);
    }

    public static ArtworkLookupResult error(String detail) {
        return new ArtworkLookupResult(Status.ERROR, null, detail);
    }
}
