package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;

/**
 * Derives a new, unsolved puzzle from the requester and the entropy observed at mint time.
 * Implementations are deterministic: the same inputs always give the same puzzle.
 */
public interface PuzzleGenerator {

    /**
     * @param requester          identity minting the asset
     * @param puzzleTypeSelector numeric puzzle type from the mint request
     * @param difficulty         0-255
     * @param entropy            slot/timestamp at mint time
     * @return unsolved puzzle
     * @throws com.puzzlenft.puzzleservice.exception.PuzzleException INVALID_PUZZLE_TYPE for unknown selectors
     */
    PuzzleInstance generate(Identity requester, int puzzleTypeSelector, int difficulty, EntropySnapshot entropy);
}
