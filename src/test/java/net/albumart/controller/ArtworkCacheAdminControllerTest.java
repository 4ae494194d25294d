package net.albumart.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import net.albumart.service.artwork.ArtworkCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArtworkCacheAdminControllerTest {

    @Mock
    private ArtworkCache artworkCache;

    @InjectMocks
    private ArtworkCacheAdminController controller;

    @Test
    void should_ClearWholeCache_When_NoParametersGiven() {
        when(artworkCache.invalidateAll()).thenReturn(42L);

        ResponseEntity<PlaybackApiPayloads.CacheInvalidationResponse> response = controller.invalidate(null, null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(new PlaybackApiPayloads.CacheInvalidationResponse("all", 42L), response.getBody());
    }

    @Test
    void should_DropSingleEntry_When_ArtistAndAlbumGiven() {
        when(artworkCache.invalidate("Pink Floyd", "The Wall")).thenReturn(true);

        ResponseEntity<PlaybackApiPayloads.CacheInvalidationResponse> response =
            controller.invalidate("Pink Floyd", "The Wall");

        assertEquals(new PlaybackApiPayloads.CacheInvalidationResponse("entry", 1L), response.getBody());
        verify(artworkCache, never()).invalidateAll();
    }

    @Test
    void should_ReportZeroRemoved_When_EntryWasNotCached() {
        when(artworkCache.invalidate("Pink Floyd", "Animals")).thenReturn(false);

        ResponseEntity<PlaybackApiPayloads.CacheInvalidationResponse> response =
            controller.invalidate("Pink Floyd", "Animals");

        assertEquals(new PlaybackApiPayloads.CacheInvalidationResponse("entry", 0L), response.getBody());
    }

    @Test
    void should_ReportCacheCounters_When_StatsRequested() {
        when(artworkCache.size()).thenReturn(12L);
        when(artworkCache.stats()).thenReturn(CacheStats.of(30, 10, 0, 0, 0, 2, 2));

        ResponseEntity<PlaybackApiPayloads.CacheStatsResponse> response = controller.stats();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(new PlaybackApiPayloads.CacheStatsResponse(12L, 30L, 10L, 0.75, 2L), response.getBody());
    }

    @Test
    void should_RejectRequest_When_OnlyArtistGiven() {
        ResponseStatusException exception =
            assertThrows(ResponseStatusException.class, () -> controller.invalidate("Pink Floyd", " "));

        assertEquals(HttpStatus.BAD_REQUEST, exception.getStatusCode());
        verifyNoInteractions(artworkCache);
    }
}
