package com.puzzlenft.puzzleservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger row for a puzzle asset. The attribute list keeps its insertion order; the version
 * column makes a write against a stale read fail instead of overwriting a concurrent solve.
 */
@Entity
@Table(name = "puzzle_assets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleAsset {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "collection_id", length = 36)
    private String collectionId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "uri", nullable = false, length = 500)
    private String uri;

    @Column(name = "owner", nullable = false, length = 64)
    private String owner;

    @Column(name = "update_authority", nullable = false, length = 64)
    private String updateAuthority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "puzzle_asset_attributes", joinColumns = @JoinColumn(name = "asset_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<AssetAttribute> attributes = new ArrayList<>();

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
