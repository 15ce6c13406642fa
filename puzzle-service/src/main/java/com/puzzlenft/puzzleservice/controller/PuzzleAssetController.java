package com.puzzlenft.puzzleservice.controller;

import com.puzzlenft.puzzleservice.dto.AssetResponse;
import com.puzzlenft.puzzleservice.dto.MintRequest;
import com.puzzlenft.puzzleservice.dto.MintResponse;
import com.puzzlenft.puzzleservice.dto.SolveRequest;
import com.puzzlenft.puzzleservice.dto.SolveResponse;
import com.puzzlenft.puzzleservice.dto.UriUpdateRequest;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.security.JwtUtil;
import com.puzzlenft.puzzleservice.service.PuzzleAssetService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assets")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class PuzzleAssetController {

    private final PuzzleAssetService assetService;
    private final JwtUtil jwtUtil;

    public PuzzleAssetController(PuzzleAssetService assetService, JwtUtil jwtUtil) {
        this.assetService = assetService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * POST /api/assets
     * Mint a new puzzle asset owned by the caller
     */
    @PostMapping
    public ResponseEntity<MintResponse> mint(
            @RequestHeader("Authorization") String authHeader,
            @Valid @RequestBody MintRequest request) {

        Identity minter = jwtUtil.extractIdentityFromHeader(authHeader);
        return ResponseEntity.status(HttpStatus.CREATED).body(assetService.mint(minter, request));
    }

    /**
     * POST /api/assets/{id}/solve
     * Submit a solution; only the owner may solve, and only once
     */
    @PostMapping("/{id}/solve")
    public ResponseEntity<SolveResponse> solve(
            @RequestHeader("Authorization") String authHeader,
            @PathVariable String id,
            @Valid @RequestBody SolveRequest request) {

        Identity solver = jwtUtil.extractIdentityFromHeader(authHeader);
        return ResponseEntity.ok(assetService.solve(solver, id, request));
    }

    /**
     * PATCH /api/assets/{id}/uri
     * Metadata-only URI change by the asset's update authority
     */
    @PatchMapping("/{id}/uri")
    public ResponseEntity<AssetResponse> updateUri(
            @RequestHeader("Authorization") String authHeader,
            @PathVariable String id,
            @Valid @RequestBody UriUpdateRequest request) {

        Identity caller = jwtUtil.extractIdentityFromHeader(authHeader);
        return ResponseEntity.ok(assetService.updateUri(caller, id, request.getUri()));
    }

    /**
     * GET /api/assets/mine
     */
    @GetMapping("/mine")
    public ResponseEntity<List<AssetResponse>> getMyAssets(
            @RequestHeader("Authorization") String authHeader) {

        Identity owner = jwtUtil.extractIdentityFromHeader(authHeader);
        return ResponseEntity.ok(assetService.getAssetsOwnedBy(owner));
    }

    /**
     * GET /api/assets/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<AssetResponse> getAsset(@PathVariable String id) {
        return ResponseEntity.ok(assetService.getAsset(id));
    }
}
