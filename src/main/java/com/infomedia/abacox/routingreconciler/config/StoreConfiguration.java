package com.infomedia.abacox.routingreconciler.config;

import com.infomedia.abacox.routingreconciler.component.store.JdbcNumbersStore;
import com.infomedia.abacox.routingreconciler.component.store.JdbcProvisioningStore;
import com.infomedia.abacox.routingreconciler.component.store.NumbersStore;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningStore;
import com.infomedia.abacox.routingreconciler.component.store.RedissonRoutingCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store clients. Missing connection settings do not stop the application;
 * they are reported when the store is first used.
 */
@Configuration
public class StoreConfiguration {

    @Value("${reconciler.numbers.dsn:}")
    private String numbersDsn;

    @Value("${reconciler.routing-cache.url:}")
    private String routingCacheUrl;

    @Value("${reconciler.routing-cache.database:9}")
    private int routingCacheDatabase;

    @Value("${reconciler.provisioning.host:}")
    private String provisioningHost;

    @Value("${reconciler.provisioning.port:3306}")
    private int provisioningPort;

    @Value("${reconciler.provisioning.user:}")
    private String provisioningUser;

    @Value("${reconciler.provisioning.password:}")
    private String provisioningPassword;

    @Value("${reconciler.provisioning.database:dispatcher-api2}")
    private String provisioningDatabase;

    @Bean
    public NumbersStore numbersStore() {
        return new JdbcNumbersStore(numbersDsn);
    }

    @Bean(destroyMethod = "shutdown")
    public RedissonRoutingCacheStore routingCacheStore() {
        return new RedissonRoutingCacheStore(routingCacheUrl, routingCacheDatabase);
    }

    @Bean
    public ProvisioningStore provisioningStore() {
        return new JdbcProvisioningStore(provisioningHost, provisioningPort, provisioningUser,
                provisioningPassword, provisioningDatabase);
    }
}
