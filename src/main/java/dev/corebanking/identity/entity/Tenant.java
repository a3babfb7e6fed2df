package dev.corebanking.identity.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Control-plane record of an isolated customer organisation.
 * Created by the administrative provisioning flow; read-only here.
 */
@Table("tenants")
@Getter
@Setter
@ToString(exclude = {"databaseUrl"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    private String id;

    private String name;

    private String slug;

    /** Opaque locator of the tenant's dedicated data store (an r2dbc URL). */
    @Column("database_url")
    private String databaseUrl;

    @Builder.Default
    private TenantStatus status = TenantStatus.ACTIVE;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }
}
