package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.CommitmentScheme;
import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import com.puzzlenft.puzzleservice.model.PuzzleType;

/**
 * Canonical generator. The puzzle number mixes the mint slot, difficulty and type:
 * {@code ((slot % 1000) + 1) * (difficulty + 1) + (typeIndex + 1) * 100}.
 * The solution hash is the iterated hash of that number.
 */
public class IteratedHashPuzzleGenerator implements PuzzleGenerator {

    @Override
    public PuzzleInstance generate(Identity requester, int puzzleTypeSelector, int difficulty, EntropySnapshot entropy) {
        PuzzleType type = PuzzleType.fromSelector(puzzleTypeSelector);
        long puzzleNumber = puzzleNumber(entropy.getSlot(), type, difficulty);

        return PuzzleInstance.builder()
                .puzzleType(type)
                .difficulty(difficulty)
                .scheme(CommitmentScheme.ITERATED_HASH)
                .puzzleNumber(puzzleNumber)
                .solutionHash(PuzzleHashing.iteratedHash(puzzleNumber))
                .mintSlot(entropy.getSlot())
                .solved(false)
                .build();
    }

    static long puzzleNumber(long slot, PuzzleType type, int difficulty) {
        long base = (Math.floorMod(slot, 1000L) + 1) * (difficulty + 1L);
        long modifier = (type.getSelector() + 1L) * 100;
        return base + modifier;
    }
}
