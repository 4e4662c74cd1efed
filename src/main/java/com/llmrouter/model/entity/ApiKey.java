package com.llmrouter.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * API key entity. Only the SHA-256 hash of the secret is stored.
 *
 * Keys are never deleted; revocation flips {@code active} to false so that
 * usage history keeps pointing at a real row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKey implements Persistable<String> {

    @Id
    private String id;

    @Column("secret_hash")
    private String secretHash;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("is_active")
    private boolean active;

    @Column("rate_limit")
    private int rateLimit;

    @Column("usage_count")
    private long usageCount;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("last_used_at")
    private LocalDateTime lastUsedAt;

    /**
     * Ids are assigned by the application, so inserts have to be flagged explicitly.
     */
    @Transient
    private boolean fresh;

    @Override
    public boolean isNew() {
        return fresh;
    }
}
