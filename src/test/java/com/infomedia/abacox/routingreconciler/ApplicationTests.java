package com.infomedia.abacox.routingreconciler;

import com.infomedia.abacox.routingreconciler.component.store.NumbersStore;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningStore;
import com.infomedia.abacox.routingreconciler.component.store.RoutingCacheStore;
import com.infomedia.abacox.routingreconciler.controller.FixController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ApplicationTests {

    @Autowired
    private FixController fixController;
    @Autowired
    private NumbersStore numbersStore;
    @Autowired
    private RoutingCacheStore routingCacheStore;
    @Autowired
    private ProvisioningStore provisioningStore;

    @Test
    void contextLoadsWithoutStoreSettings() {
        assertThat(fixController).isNotNull();
        assertThat(numbersStore).isNotNull();
        assertThat(provisioningStore).isNotNull();
        assertThat(routingCacheStore.getDatabase()).isEqualTo(9);
    }
}
