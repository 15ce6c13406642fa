package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.event.MintedEvent;
import com.puzzlenft.puzzleservice.event.SolvedEvent;
import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import com.puzzlenft.puzzleservice.model.AssetRecord;
import com.puzzlenft.puzzleservice.model.Attribute;
import com.puzzlenft.puzzleservice.model.AttributeList;
import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.MintResult;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import com.puzzlenft.puzzleservice.model.Rarity;
import com.puzzlenft.puzzleservice.model.SolveResult;
import com.puzzlenft.puzzleservice.model.UpdateAuthority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Create and solve transitions of a puzzle: {@code Unsolved -> Solved}, nothing else.
 * <p>
 * Both transitions are pure functions of their inputs. Nothing is written here; the caller
 * persists the returned attribute list. A rejected call returns no partial result, so the
 * asset stays exactly as it was read. Callers must pass a freshly read asset on every attempt.
 */
@Slf4j
@Component
public class PuzzleStateMachine {

    private static final int MAX_DIFFICULTY = 255;

    private final PuzzleGenerator generator;
    private final AttributeCodec codec;
    private final OwnershipGuard ownershipGuard;
    private final SolutionVerifier verifier;
    private final RarityAssigner rarityAssigner;

    public PuzzleStateMachine(PuzzleGenerator generator,
                              AttributeCodec codec,
                              OwnershipGuard ownershipGuard,
                              SolutionVerifier verifier,
                              RarityAssigner rarityAssigner) {
        this.generator = generator;
        this.codec = codec;
        this.ownershipGuard = ownershipGuard;
        this.verifier = verifier;
        this.rarityAssigner = rarityAssigner;
    }

    /**
     * Build the initial attribute list for a new asset.
     *
     * @param assetId            id the ledger will store the asset under
     * @param minter             requester identity, also the seed for some generators
     * @param puzzleTypeSelector numeric type from the request
     * @param difficulty         0-255
     * @param entropy            slot/timestamp at mint time
     * @param extra              caller metadata appended after the puzzle keys
     */
    public MintResult create(String assetId,
                             Identity minter,
                             int puzzleTypeSelector,
                             int difficulty,
                             EntropySnapshot entropy,
                             List<Attribute> extra) {
        if (difficulty < 0 || difficulty > MAX_DIFFICULTY) {
            throw new IllegalArgumentException("Difficulty must be between 0 and " + MAX_DIFFICULTY);
        }
        PuzzleInstance puzzle = generator.generate(minter, puzzleTypeSelector, difficulty, entropy);
        AttributeList attributes = codec.appendExtra(codec.encode(puzzle), extra);

        MintedEvent event = new MintedEvent(assetId, puzzle.getPuzzleType(), puzzle.getPuzzleNumber(), minter);
        return new MintResult(puzzle, attributes, event);
    }

    /**
     * Attempt to solve the puzzle on {@code asset}.
     *
     * @param asset     freshly read asset
     * @param claimant  identity submitting the solution
     * @param solution  candidate solution
     * @param newUri    replacement metadata URI, or null to keep the current one
     * @param entropy   slot/timestamp at solve time
     * @param authority capability used to write the asset's metadata
     * @return updated attributes, URI and event
     * @throws PuzzleException INVALID_ASSET_DATA, UNAUTHORIZED_UPDATE, decode errors,
     *                         ALREADY_SOLVED, NOT_NFT_OWNER or INCORRECT_SOLUTION, checked in that order
     */
    public SolveResult solve(AssetRecord asset,
                             Identity claimant,
                             long solution,
                             String newUri,
                             EntropySnapshot entropy,
                             UpdateAuthority authority) {
        if (asset == null || asset.getAssetId() == null || asset.getOwner() == null || asset.getAttributes() == null) {
            throw new PuzzleException(PuzzleErrorCode.INVALID_ASSET_DATA, "incomplete asset record");
        }
        String assetId = asset.getAssetId();
        if (authority == null || !ownershipGuard.verifyUpdateAuthority(authority.getIdentity(), asset)) {
            throw reject(assetId, PuzzleErrorCode.UNAUTHORIZED_UPDATE);
        }

        PuzzleInstance puzzle = codec.decode(asset.getAttributes());
        if (puzzle.isSolved()) {
            throw reject(assetId, PuzzleErrorCode.ALREADY_SOLVED);
        }

        boolean owner = asset.getHolding() == null
                ? ownershipGuard.verifyOwner(claimant, asset)
                : ownershipGuard.verifyOwner(claimant, asset, asset.getHolding());
        if (!owner) {
            throw reject(assetId, PuzzleErrorCode.NOT_NFT_OWNER);
        }

        if (!verifier.verify(puzzle, solution)) {
            throw reject(assetId, PuzzleErrorCode.INCORRECT_SOLUTION);
        }

        long timestamp = entropy.getTimestamp();
        Rarity rarity = rarityAssigner.assign(timestamp);
        PuzzleInstance solved = puzzle.markSolved(claimant, solution, timestamp, rarity);

        Map<String, String> updates = new LinkedHashMap<>();
        updates.put(AttributeCodec.SOLVED, "true");
        updates.put(AttributeCodec.SOLVER, claimant.toHex());
        updates.put(AttributeCodec.SOLUTION, Long.toString(solution));
        updates.put(AttributeCodec.SOLVE_TIMESTAMP, Long.toString(timestamp));
        updates.put(AttributeCodec.RARITY, rarity.getDisplayName());
        if (asset.getAttributes().containsKey(AttributeCodec.HIDDEN_TRAIT)) {
            updates.put(AttributeCodec.HIDDEN_TRAIT, rarity.getDisplayName() + " Solver");
        }
        AttributeList updated = codec.mergeUpdate(asset.getAttributes(), updates);

        SolvedEvent event = new SolvedEvent(assetId, claimant, timestamp, rarity);
        return new SolveResult(solved, updated, newUri, event);
    }

    private PuzzleException reject(String assetId, PuzzleErrorCode code) {
        log.debug("Solve rejected for asset {}: {}", assetId, code);
        return new PuzzleException(code, "asset " + assetId);
    }
}
