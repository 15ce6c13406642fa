package com.puzzlenft.puzzleservice.controller;

import com.puzzlenft.puzzleservice.dto.AssetResponse;
import com.puzzlenft.puzzleservice.dto.CollectionRequest;
import com.puzzlenft.puzzleservice.dto.CollectionResponse;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.security.JwtUtil;
import com.puzzlenft.puzzleservice.service.PuzzleAssetService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/collections")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class CollectionController {

    private final PuzzleAssetService assetService;
    private final JwtUtil jwtUtil;

    public CollectionController(PuzzleAssetService assetService, JwtUtil jwtUtil) {
        this.assetService = assetService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * POST /api/collections
     */
    @PostMapping
    public ResponseEntity<CollectionResponse> createCollection(
            @RequestHeader("Authorization") String authHeader,
            @Valid @RequestBody CollectionRequest request) {

        Identity creator = jwtUtil.extractIdentityFromHeader(authHeader);
        return ResponseEntity.status(HttpStatus.CREATED).body(assetService.createCollection(creator, request));
    }

    /**
     * GET /api/collections/{id}/assets
     */
    @GetMapping("/{id}/assets")
    public ResponseEntity<List<AssetResponse>> getCollectionAssets(@PathVariable String id) {
        return ResponseEntity.ok(assetService.getCollectionAssets(id));
    }
}
