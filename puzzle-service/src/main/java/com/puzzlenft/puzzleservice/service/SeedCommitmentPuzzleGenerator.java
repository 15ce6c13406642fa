package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.CommitmentScheme;
import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import com.puzzlenft.puzzleservice.model.PuzzleType;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Alternative generator seeded by {@code SHA-256(requester || slot)}.
 * The first seed byte picks the type: even for a math factor puzzle, odd for a hash riddle.
 * The selector from the request is validated but does not override the seed.
 */
@Slf4j
public class SeedCommitmentPuzzleGenerator implements PuzzleGenerator {

    static final long MIN_NUMBER = 20; // 1, 2, 4, 5, 10, 20

    @Override
    public PuzzleInstance generate(Identity requester, int puzzleTypeSelector, int difficulty, EntropySnapshot entropy) {
        PuzzleType requested = PuzzleType.fromSelector(puzzleTypeSelector);

        byte[] seed = PuzzleHashing.sha256(requester.toBytes(), PuzzleHashing.bigEndian(entropy.getSlot()));
        int firstByte = seed[0] & 0xff;
        PuzzleType type = firstByte % 2 == 0 ? PuzzleType.MATH_FACTOR : PuzzleType.HASH_RIDDLE;
        if (type != requested) {
            log.debug("Seed selected {} instead of requested {}", type, requested);
        }

        PuzzleInstance.PuzzleInstanceBuilder builder = PuzzleInstance.builder()
                .puzzleType(type)
                .difficulty(difficulty)
                .scheme(CommitmentScheme.SEED_PREFIX)
                .puzzleHash(PuzzleHashing.toHex(seed))
                .mintSlot(entropy.getSlot())
                .solved(false);

        if (type == PuzzleType.MATH_FACTOR) {
            long number = Math.max(MIN_NUMBER, (firstByte % 45 + 10) * 2L);
            builder.puzzleNumber(number)
                    .solutionHash(PuzzleHashing.iteratedHash(number));
        } else {
            byte[] prefix = Arrays.copyOf(seed, PuzzleHashing.SEED_PREFIX_LENGTH);
            builder.solutionHash(PuzzleHashing.toHex(prefix));
        }
        return builder.build();
    }
}
