package com.puzzlenft.puzzleservice.model;

import lombok.Value;

/**
 * A single key/value pair of asset metadata
 */
@Value
public class Attribute {
    String key;
    String value;
}
