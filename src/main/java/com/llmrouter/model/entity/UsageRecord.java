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
 * Append-only audit entry of tokens consumed and cost for one request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("usage_records")
public class UsageRecord implements Persistable<String> {

    @Id
    private String id;

    // Weak reference, no foreign key
    @Column("api_key_id")
    private String apiKeyId;

    @Column("provider")
    private String provider;

    @Column("model")
    private String model;

    @Column("endpoint")
    private String endpoint;

    @Column("prompt_tokens")
    private int promptTokens;

    @Column("completion_tokens")
    private int completionTokens;

    @Column("total_tokens")
    private int totalTokens;

    @Column("cost")
    private double cost;

    @Column("recorded_at")
    private LocalDateTime timestamp;

    @Transient
    private boolean fresh;

    @Override
    public boolean isNew() {
        return fresh;
    }
}
