package com.infomedia.abacox.routingreconciler.component.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreDbConfig {
    private String url; // e.g., jdbc:postgresql://<host>:<port>/<db> or jdbc:mariadb://<host>:<port>/<db>
    private String username;
    private String password;
    private String driverClassName;
}
