package com.puzzlenft.puzzleservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stored key/value pair of an asset's attribute list
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetAttribute {

    @Column(name = "attr_key", nullable = false, length = 64)
    private String key;

    @Column(name = "attr_value", nullable = false, length = 256)
    private String value;
}
