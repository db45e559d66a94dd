package com.infomedia.abacox.routingreconciler.service;

import com.infomedia.abacox.routingreconciler.component.numbering.NumberNormalizer;
import com.infomedia.abacox.routingreconciler.component.numbering.PreviewBuilder;
import com.infomedia.abacox.routingreconciler.component.numbering.RangeExpander;
import com.infomedia.abacox.routingreconciler.component.store.RoutingCacheStore;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.dto.fix.NprnFixResult;
import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;
import com.infomedia.abacox.routingreconciler.exception.UnsupportedNumberFormatException;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NprnFixService Tests")
class NprnFixServiceTest {

    @Mock
    private RoutingCacheStore routingCacheStore;

    private NprnFixService service;

    @BeforeEach
    void setUp() {
        NumberNormalizer normalizer = new NumberNormalizer();
        service = new NprnFixService(new PreviewBuilder(new RangeExpander(normalizer), normalizer), routingCacheStore);
    }

    @Test
    @DisplayName("dry run reports the keys and database without deleting")
    void dryRun() {
        when(routingCacheStore.getDatabase()).thenReturn(9);

        NprnFixResult result = service.fix(new FixRequest("41412345678-79", true, EnpProfile.NXP1));

        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getRedisDb()).isEqualTo(9);
        assertThat(result.getPreview().getExpandedRedisKeys())
                .containsExactly("nprn:routing:41412345678", "nprn:routing:41412345679");
        assertThat(result.getDeletedCounts()).isNull();
        verify(routingCacheStore, never()).deleteKeys(anyList());
    }

    @Test
    @DisplayName("live run returns one count per key, 0 for keys that did not exist")
    void liveRun() {
        when(routingCacheStore.getDatabase()).thenReturn(9);
        when(routingCacheStore.deleteKeys(List.of("nprn:routing:41412345678", "nprn:routing:41412345679")))
                .thenReturn(List.of(1L, 0L));

        NprnFixResult result = service.fix(new FixRequest("0412345678-79", false, EnpProfile.NXP1));

        assertThat(result.isDryRun()).isFalse();
        assertThat(result.getDeletedCounts()).containsExactly(1L, 0L);
    }

    @Test
    @DisplayName("invalid input fails before the cache is reached")
    void invalidInput() {
        assertThatThrownBy(() -> service.fix(new FixRequest("98765432", false, EnpProfile.NXP1)))
                .isInstanceOf(UnsupportedNumberFormatException.class);
        verifyNoInteractions(routingCacheStore);
    }

    @Test
    @DisplayName("a blank input is an unsupported number format")
    void blankInput() {
        assertThatThrownBy(() -> service.fix(new FixRequest("   ", true, EnpProfile.NXP1)))
                .isInstanceOf(UnsupportedNumberFormatException.class)
                .hasMessage("Unsupported number format: ")
                .extracting("kind").isEqualTo("UnsupportedNumberFormat");
        verifyNoInteractions(routingCacheStore);
    }

    @Test
    @DisplayName("an unconfigured cache surfaces as a missing connection")
    void missingConnection() {
        when(routingCacheStore.getDatabase()).thenReturn(9);
        when(routingCacheStore.deleteKeys(anyList())).thenThrow(new StoreConnectionMissingException("REDIS_URL missing"));

        assertThatThrownBy(() -> service.fix(new FixRequest("0412345678", false, EnpProfile.NXP1)))
                .isInstanceOf(StoreConnectionMissingException.class)
                .hasMessage("REDIS_URL missing");
    }
}
