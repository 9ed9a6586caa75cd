package com.github.raff.webhook.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.*;
import lombok.experimental.FieldNameConstants;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/** Merchant connected through one or both platforms; read-only from this service. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldNameConstants
@Table("merchants")
public class Merchant {

    @Id
    private String id;

    private String name;

    @Column("salla_store_id")
    private String sallaStoreId;

    @Column("zid_store_id")
    private String zidStoreId;

    /** Default commission percentage when the click carries none. */
    @Column("commission_rate")
    private BigDecimal commissionRate;

    @ToString.Exclude
    @Column("salla_access_token")
    private String sallaAccessToken;

    @ToString.Exclude
    @Column("zid_access_token")
    private String zidAccessToken;

    @Column("updated_at")
    private Instant updatedAt;

    public String storeId(Platform platform) {
        return platform == Platform.SALLA ? sallaStoreId : zidStoreId;
    }

    public boolean hasAccessToken(Platform platform) {
        String token = platform == Platform.SALLA ? sallaAccessToken : zidAccessToken;
        return token != null && !token.isBlank();
    }
}
