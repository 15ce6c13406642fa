package com.puzzlenft.puzzleservice.model;

import lombok.Value;

/**
 * Capability to write asset metadata on behalf of the program. Created once from configuration
 * and handed to the state machine explicitly.
 */
@Value
public class UpdateAuthority {
    Identity identity;
}
