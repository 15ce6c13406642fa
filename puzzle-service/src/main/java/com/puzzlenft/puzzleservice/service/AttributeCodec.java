package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import com.puzzlenft.puzzleservice.model.Attribute;
import com.puzzlenft.puzzleservice.model.AttributeList;
import com.puzzlenft.puzzleservice.model.CommitmentScheme;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import com.puzzlenft.puzzleservice.model.PuzzleType;
import com.puzzlenft.puzzleservice.model.Rarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between {@link PuzzleInstance} and the attribute list stored on an asset.
 * Keys outside the puzzle schema are never read or rewritten.
 */
@Component
public class AttributeCodec {

    public static final String PUZZLE_TYPE = "puzzle_type";
    public static final String DIFFICULTY = "difficulty";
    public static final String PUZZLE_NUMBER = "puzzle_number";
    public static final String PUZZLE_HASH = "puzzle_hash";
    public static final String SOLUTION_HASH = "solution_hash";
    public static final String SOLVED = "solved";
    public static final String MINT_SLOT = "mint_slot";
    public static final String SOLVER = "solver";
    public static final String SOLUTION = "solution";
    public static final String SOLVE_TIMESTAMP = "solve_timestamp";
    public static final String RARITY = "rarity";
    public static final String HIDDEN_TRAIT = "hidden_trait";

    /**
     * Keys owned by the puzzle schema. {@code hidden_trait} is not among them: it is optional
     * caller metadata that the solve transition happens to reveal.
     */
    public static final Set<String> SCHEMA_KEYS = Set.of(
            PUZZLE_TYPE, DIFFICULTY, PUZZLE_NUMBER, PUZZLE_HASH, SOLUTION_HASH, SOLVED, MINT_SLOT,
            SOLVER, SOLUTION, SOLVE_TIMESTAMP, RARITY);

    public static final int MAX_KEY_LENGTH = 64;
    public static final int MAX_VALUE_LENGTH = 256;

    private static final int MAX_DIFFICULTY = 255;
    private static final int SEED_HASH_HEX_LENGTH = 64;

    /**
     * Encode a puzzle on its own, in canonical key order.
     */
    public AttributeList encode(PuzzleInstance puzzle) {
        return encode(puzzle, AttributeList.empty());
    }

    /**
     * Encode a puzzle over an existing list. Schema keys already present keep their position,
     * everything else in {@code base} is carried over unchanged.
     */
    public AttributeList encode(PuzzleInstance puzzle, AttributeList base) {
        return mergeUpdate(base, canonicalPairs(puzzle));
    }

    /**
     * Apply updates in place: matching keys keep their position, new keys are appended.
     */
    public AttributeList mergeUpdate(AttributeList attributes, Map<String, String> updates) {
        return attributes.withUpdates(updates);
    }

    /**
     * Append caller metadata after the puzzle keys. Caller keys may not shadow schema keys and must
     * fit the stored column widths.
     */
    public AttributeList appendExtra(AttributeList attributes, List<Attribute> extra) {
        List<Attribute> combined = new ArrayList<>(attributes.asList());
        for (Attribute attribute : extra) {
            if (SCHEMA_KEYS.contains(attribute.getKey())) {
                throw new IllegalArgumentException("Attribute key is reserved: " + attribute.getKey());
            }
            if (attribute.getKey().length() > MAX_KEY_LENGTH) {
                throw new IllegalArgumentException("Attribute key longer than " + MAX_KEY_LENGTH + " characters");
            }
            if (attribute.getValue() != null && attribute.getValue().length() > MAX_VALUE_LENGTH) {
                throw new IllegalArgumentException("Value of '" + attribute.getKey() + "' longer than "
                        + MAX_VALUE_LENGTH + " characters");
            }
            combined.add(attribute);
        }
        return AttributeList.of(combined);
    }

    private Map<String, String> canonicalPairs(PuzzleInstance puzzle) {
        Map<String, String> pairs = new LinkedHashMap<>();
        pairs.put(PUZZLE_TYPE, puzzle.getPuzzleType().getWireName());
        pairs.put(DIFFICULTY, Integer.toString(puzzle.getDifficulty()));
        if (puzzle.getPuzzleNumber() != null) {
            pairs.put(PUZZLE_NUMBER, Long.toString(puzzle.getPuzzleNumber()));
        }
        if (puzzle.getScheme() == CommitmentScheme.SEED_PREFIX) {
            pairs.put(PUZZLE_HASH, puzzle.getPuzzleHash());
        }
        pairs.put(SOLUTION_HASH, puzzle.getSolutionHash());
        pairs.put(SOLVED, Boolean.toString(puzzle.isSolved()));
        pairs.put(MINT_SLOT, Long.toString(puzzle.getMintSlot()));
        if (puzzle.isSolved()) {
            pairs.put(SOLVER, puzzle.getSolver().toHex());
            pairs.put(SOLUTION, Long.toString(puzzle.getSolution()));
            pairs.put(SOLVE_TIMESTAMP, Long.toString(puzzle.getSolvedAt()));
            pairs.put(RARITY, puzzle.getRarity().getDisplayName());
        }
        return pairs;
    }

    /**
     * Read the puzzle back out of an attribute list.
     *
     * @throws PuzzleException PUZZLE_NOT_FOUND or ATTRIBUTE_NOT_FOUND when a required key is
     *                         missing, FAILED_TO_PARSE_PUZZLE_DATA when a value has the wrong shape,
     *                         INVALID_PUZZLE_TYPE for an unknown type name
     */
    public PuzzleInstance decode(AttributeList attributes) {
        PuzzleType type = PuzzleType.fromWireName(require(attributes, PUZZLE_TYPE, PuzzleErrorCode.PUZZLE_NOT_FOUND));
        int difficulty = parseInt(DIFFICULTY, require(attributes, DIFFICULTY, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND));
        if (difficulty < 0 || difficulty > MAX_DIFFICULTY) {
            throw parseFailure(DIFFICULTY, Integer.toString(difficulty));
        }

        String puzzleHash = attributes.get(PUZZLE_HASH).orElse(null);
        CommitmentScheme scheme = puzzleHash != null ? CommitmentScheme.SEED_PREFIX : CommitmentScheme.ITERATED_HASH;
        if (puzzleHash != null && (puzzleHash.length() != SEED_HASH_HEX_LENGTH || !PuzzleHashing.isLowerHex(puzzleHash))) {
            throw parseFailure(PUZZLE_HASH, puzzleHash);
        }

        Long puzzleNumber = null;
        boolean numberRequired = scheme == CommitmentScheme.ITERATED_HASH || type == PuzzleType.MATH_FACTOR;
        if (numberRequired || attributes.containsKey(PUZZLE_NUMBER)) {
            puzzleNumber = parseLong(PUZZLE_NUMBER, require(attributes, PUZZLE_NUMBER, PuzzleErrorCode.PUZZLE_NOT_FOUND));
        }

        String solutionHash = require(attributes, SOLUTION_HASH, PuzzleErrorCode.PUZZLE_NOT_FOUND);
        if (!PuzzleHashing.isLowerHex(solutionHash)) {
            throw parseFailure(SOLUTION_HASH, solutionHash);
        }

        boolean solved = parseBoolean(SOLVED, require(attributes, SOLVED, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND));
        long mintSlot = parseLong(MINT_SLOT, require(attributes, MINT_SLOT, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND));

        PuzzleInstance.PuzzleInstanceBuilder builder = PuzzleInstance.builder()
                .puzzleType(type)
                .difficulty(difficulty)
                .scheme(scheme)
                .puzzleNumber(puzzleNumber)
                .puzzleHash(puzzleHash)
                .solutionHash(solutionHash)
                .mintSlot(mintSlot)
                .solved(solved);

        if (solved) {
            builder.solver(parseIdentity(require(attributes, SOLVER, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND)))
                    .solution(parseLong(SOLUTION, require(attributes, SOLUTION, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND)))
                    .solvedAt(parseLong(SOLVE_TIMESTAMP, require(attributes, SOLVE_TIMESTAMP, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND)))
                    .rarity(Rarity.fromDisplayName(require(attributes, RARITY, PuzzleErrorCode.ATTRIBUTE_NOT_FOUND)));
        } else {
            for (String key : List.of(SOLVER, SOLUTION, SOLVE_TIMESTAMP, RARITY)) {
                if (attributes.containsKey(key)) {
                    throw new PuzzleException(PuzzleErrorCode.FAILED_TO_PARSE_PUZZLE_DATA,
                            "'" + key + "' present on an unsolved puzzle");
                }
            }
        }
        return builder.build();
    }

    private String require(AttributeList attributes, String key, PuzzleErrorCode missingCode) {
        return attributes.get(key)
                .orElseThrow(() -> new PuzzleException(missingCode, "missing '" + key + "'"));
    }

    private int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw parseFailure(key, value, e);
        }
    }

    private long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw parseFailure(key, value, e);
        }
    }

    private boolean parseBoolean(String key, String value) {
        return switch (value) {
            case "true" -> true;
            case "false" -> false;
            default -> throw parseFailure(key, value);
        };
    }

    private Identity parseIdentity(String value) {
        try {
            return Identity.fromHex(value);
        } catch (IllegalArgumentException e) {
            throw parseFailure(SOLVER, value, e);
        }
    }

    private PuzzleException parseFailure(String key, String value) {
        return new PuzzleException(PuzzleErrorCode.FAILED_TO_PARSE_PUZZLE_DATA, "'" + key + "' = '" + value + "'");
    }

    private PuzzleException parseFailure(String key, String value, Throwable cause) {
        return new PuzzleException(PuzzleErrorCode.FAILED_TO_PARSE_PUZZLE_DATA, "'" + key + "' = '" + value + "'", cause);
    }
}
