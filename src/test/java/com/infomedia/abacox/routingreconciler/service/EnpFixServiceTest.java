package com.infomedia.abacox.routingreconciler.service;

import com.infomedia.abacox.routingreconciler.component.numbering.NumberNormalizer;
import com.infomedia.abacox.routingreconciler.component.numbering.PreviewBuilder;
import com.infomedia.abacox.routingreconciler.component.numbering.RangeExpander;
import com.infomedia.abacox.routingreconciler.component.store.NumbersStore;
import com.infomedia.abacox.routingreconciler.dto.fix.EnpFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.exception.RangeEndBeforeStartException;
import com.infomedia.abacox.routingreconciler.exception.StoreOperationFailedException;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnpFixService Tests")
class EnpFixServiceTest {

    @Mock
    private NumbersStore numbersStore;

    private EnpFixService service;

    @BeforeEach
    void setUp() {
        NumberNormalizer normalizer = new NumberNormalizer();
        service = new EnpFixService(new PreviewBuilder(new RangeExpander(normalizer), normalizer), numbersStore);
    }

    @Test
    @DisplayName("dry run echoes the profile and never touches the store")
    void dryRun() {
        EnpFixResult result = service.fix(new FixRequest("0412345678-680", true, EnpProfile.NXP2));

        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getEnpTarget()).isEqualTo(EnpProfile.NXP2);
        assertThat(result.getSystemId()).isEqualTo(510);
        assertThat(result.getNprn()).isEqualTo(98019);
        assertThat(result.getPreview().getCount()).isEqualTo(3);
        assertThat(result.getPreview().getExpandedDns())
                .containsExactly("41412345678", "41412345679", "41412345680");
        assertThat(result.getUpdatedDns()).isNull();
        verifyNoInteractions(numbersStore);
    }

    @Test
    @DisplayName("live run reassigns the dns and reports what the store updated")
    void liveRun() {
        when(numbersStore.reassign(anyList(), any())).thenReturn(List.of("41412345679"));

        EnpFixResult result = service.fix(new FixRequest("0412345678-680", false, EnpProfile.NXP1));

        verify(numbersStore).reassign(List.of("41412345678", "41412345679", "41412345680"), EnpProfile.NXP1);
        assertThat(result.isDryRun()).isFalse();
        assertThat(result.getSystemId()).isEqualTo(500);
        assertThat(result.getNprn()).isEqualTo(98067);
        assertThat(result.getUpdatedDns()).containsExactly("41412345679");
    }

    @Test
    @DisplayName("a missing platform defaults to NXP1")
    void defaultProfile() {
        EnpFixResult result = service.fix(new FixRequest("0412345678", true, null));

        assertThat(result.getEnpTarget()).isEqualTo(EnpProfile.NXP1);
        assertThat(result.getSystemId()).isEqualTo(500);
    }

    @Test
    @DisplayName("invalid input fails before the store is reached")
    void invalidInput() {
        assertThatThrownBy(() -> service.fix(new FixRequest("0412345681-678", false, EnpProfile.NXP1)))
                .isInstanceOf(RangeEndBeforeStartException.class);
        verifyNoInteractions(numbersStore);
    }

    @Test
    @DisplayName("store failures propagate")
    void storeFailure() {
        when(numbersStore.reassign(anyList(), any()))
                .thenThrow(new StoreOperationFailedException("boom", new SQLException("boom")));

        assertThatThrownBy(() -> service.fix(new FixRequest("0412345678", false, EnpProfile.NXP1)))
                .isInstanceOf(StoreOperationFailedException.class);
    }
}
