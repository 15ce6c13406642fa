package com.puzzlenft.puzzleservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A collection that puzzle assets are minted into
 */
@Entity
@Table(name = "puzzle_collections")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleCollection {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "uri", nullable = false, length = 500)
    private String uri;

    @Column(name = "update_authority", nullable = false, length = 64)
    private String updateAuthority;

    @Column(name = "created_by", nullable = false, length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
