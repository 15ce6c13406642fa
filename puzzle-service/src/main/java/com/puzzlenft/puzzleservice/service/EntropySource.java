package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.EntropySnapshot;

/**
 * Supplies the slot counter and timestamp that puzzles and rarities are derived from.
 */
public interface EntropySource {

    EntropySnapshot snapshot();
}
