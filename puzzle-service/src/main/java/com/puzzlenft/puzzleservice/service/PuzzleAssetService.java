package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.config.PuzzleProperties;
import com.puzzlenft.puzzleservice.dto.AssetResponse;
import com.puzzlenft.puzzleservice.dto.AttributeDto;
import com.puzzlenft.puzzleservice.dto.CollectionRequest;
import com.puzzlenft.puzzleservice.dto.CollectionResponse;
import com.puzzlenft.puzzleservice.dto.MintRequest;
import com.puzzlenft.puzzleservice.dto.MintResponse;
import com.puzzlenft.puzzleservice.dto.SolveRequest;
import com.puzzlenft.puzzleservice.dto.SolveResponse;
import com.puzzlenft.puzzleservice.entity.AssetAttribute;
import com.puzzlenft.puzzleservice.entity.PuzzleAsset;
import com.puzzlenft.puzzleservice.entity.PuzzleCollection;
import com.puzzlenft.puzzleservice.event.MintedEvent;
import com.puzzlenft.puzzleservice.event.SolvedEvent;
import com.puzzlenft.puzzleservice.exception.AssetNotFoundException;
import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import com.puzzlenft.puzzleservice.model.AssetRecord;
import com.puzzlenft.puzzleservice.model.Attribute;
import com.puzzlenft.puzzleservice.model.AttributeList;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.MintResult;
import com.puzzlenft.puzzleservice.model.SolveResult;
import com.puzzlenft.puzzleservice.model.UpdateAuthority;
import com.puzzlenft.puzzleservice.repository.PuzzleAssetRepository;
import com.puzzlenft.puzzleservice.repository.PuzzleCollectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Asset ledger operations: collections, minting, solving and metadata updates.
 * Every state change reads the asset fresh inside its own transaction and writes it back in one
 * step; a concurrent writer that committed first makes the second write fail on the version check.
 */
@Slf4j
@Service
public class PuzzleAssetService {

    private final PuzzleStateMachine stateMachine;
    private final OwnershipGuard ownershipGuard;
    private final EntropySource entropySource;
    private final UpdateAuthority updateAuthority;
    private final PuzzleAssetRepository assetRepository;
    private final PuzzleCollectionRepository collectionRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final PuzzleProperties properties;

    public PuzzleAssetService(PuzzleStateMachine stateMachine,
                              OwnershipGuard ownershipGuard,
                              EntropySource entropySource,
                              UpdateAuthority updateAuthority,
                              PuzzleAssetRepository assetRepository,
                              PuzzleCollectionRepository collectionRepository,
                              ApplicationEventPublisher eventPublisher,
                              PuzzleProperties properties) {
        this.stateMachine = stateMachine;
        this.ownershipGuard = ownershipGuard;
        this.entropySource = entropySource;
        this.updateAuthority = updateAuthority;
        this.assetRepository = assetRepository;
        this.collectionRepository = collectionRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * Register a collection whose update authority is the program authority
     */
    @Transactional
    public CollectionResponse createCollection(Identity creator, CollectionRequest request) {
        PuzzleProperties.Collection defaults = properties.getCollection();
        PuzzleCollection collection = PuzzleCollection.builder()
                .id(UUID.randomUUID().toString())
                .name(isBlank(request.getName()) ? defaults.getDefaultName() : request.getName())
                .uri(isBlank(request.getUri()) ? defaults.getDefaultUri() : request.getUri())
                .updateAuthority(updateAuthority.getIdentity().toHex())
                .createdBy(creator.toHex())
                .build();
        collection = collectionRepository.save(collection);

        log.info("Collection {} '{}' created by {}", collection.getId(), collection.getName(), creator);
        return toResponse(collection);
    }

    /**
     * Mint an asset owned by {@code minter} with a freshly generated puzzle
     */
    @Transactional
    public MintResponse mint(Identity minter, MintRequest request) {
        if (request.getCollectionId() != null) {
            PuzzleCollection collection = collectionRepository.findById(request.getCollectionId())
                    .orElseThrow(() -> new AssetNotFoundException("Collection", request.getCollectionId()));
            if (!updateAuthority.getIdentity().toHex().equals(collection.getUpdateAuthority())) {
                throw new PuzzleException(PuzzleErrorCode.INVALID_COLLECTION_AUTHORITY, collection.getId());
            }
        }

        List<Attribute> extra = new ArrayList<>();
        if (request.getAttributes() != null) {
            for (AttributeDto dto : request.getAttributes()) {
                extra.add(new Attribute(dto.getKey(), dto.getValue()));
            }
        }
        if (properties.getMint().isHiddenTrait()
                && extra.stream().noneMatch(a -> a.getKey().equals(AttributeCodec.HIDDEN_TRAIT))) {
            extra.add(new Attribute(AttributeCodec.HIDDEN_TRAIT, "???"));
        }

        String assetId = UUID.randomUUID().toString();
        MintResult result = stateMachine.create(assetId, minter, request.getPuzzleType(),
                request.getDifficulty(), entropySource.snapshot(), extra);

        PuzzleAsset asset = PuzzleAsset.builder()
                .id(assetId)
                .collectionId(request.getCollectionId())
                .name(request.getName())
                .uri(request.getUri())
                .owner(minter.toHex())
                .updateAuthority(updateAuthority.getIdentity().toHex())
                .attributes(toEntities(result.getAttributes()))
                .build();
        asset = assetRepository.saveAndFlush(asset);

        MintedEvent event = result.getEvent();
        eventPublisher.publishEvent(event);

        return MintResponse.builder()
                .assetId(assetId)
                .puzzleType(event.getPuzzleType().getWireName())
                .puzzleNumber(event.getPuzzleNumber())
                .minter(minter.toHex())
                .asset(toResponse(asset))
                .build();
    }

    /**
     * Submit a solution for the puzzle on an asset
     */
    @Transactional
    public SolveResponse solve(Identity solver, String assetId, SolveRequest request) {
        PuzzleAsset asset = findAsset(assetId);

        SolveResult result = stateMachine.solve(toRecord(asset), solver, request.getSolution(),
                request.getNewUri(), entropySource.snapshot(), updateAuthority);

        asset.getAttributes().clear();
        asset.getAttributes().addAll(toEntities(result.getAttributes()));
        if (result.getNewUri() != null) {
            asset.setUri(result.getNewUri());
            log.info("URI of asset {} updated to {}", assetId, result.getNewUri());
        }
        assetRepository.saveAndFlush(asset);

        SolvedEvent event = result.getEvent();
        eventPublisher.publishEvent(event);

        return SolveResponse.builder()
                .assetId(assetId)
                .solver(solver.toHex())
                .solveTimestamp(event.getSolveTimestamp())
                .rarity(event.getRarity().getDisplayName())
                .asset(toResponse(asset))
                .build();
    }

    /**
     * Change an asset's metadata URI. Only the asset's update authority may do this.
     */
    @Transactional
    public AssetResponse updateUri(Identity caller, String assetId, String uri) {
        PuzzleAsset asset = findAsset(assetId);
        if (!ownershipGuard.verifyUpdateAuthority(caller, toRecord(asset))) {
            throw new PuzzleException(PuzzleErrorCode.UNAUTHORIZED_UPDATE, "asset " + assetId);
        }
        asset.setUri(uri);
        assetRepository.saveAndFlush(asset);

        log.info("URI of asset {} updated to {} by {}", assetId, uri, caller);
        return toResponse(asset);
    }

    @Transactional(readOnly = true)
    public AssetResponse getAsset(String assetId) {
        return toResponse(findAsset(assetId));
    }

    @Transactional(readOnly = true)
    public List<AssetResponse> getAssetsOwnedBy(Identity owner) {
        return assetRepository.findByOwnerOrderByCreatedAtDesc(owner.toHex()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AssetResponse> getCollectionAssets(String collectionId) {
        if (!collectionRepository.existsById(collectionId)) {
            throw new AssetNotFoundException("Collection", collectionId);
        }
        return assetRepository.findByCollectionIdOrderByCreatedAtDesc(collectionId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    private PuzzleAsset findAsset(String assetId) {
        return assetRepository.findById(assetId)
                .orElseThrow(() -> new AssetNotFoundException("Asset", assetId));
    }

    /**
     * Ledger row to engine snapshot. A row that cannot be read back is invalid asset data.
     */
    private AssetRecord toRecord(PuzzleAsset asset) {
        try {
            List<Attribute> attributes = asset.getAttributes().stream()
                    .map(a -> new Attribute(a.getKey(), a.getValue()))
                    .collect(Collectors.toList());
            return AssetRecord.builder()
                    .assetId(asset.getId())
                    .owner(Identity.fromHex(asset.getOwner()))
                    .updateAuthority(Identity.fromHex(asset.getUpdateAuthority()))
                    .uri(asset.getUri())
                    .attributes(AttributeList.of(attributes))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PuzzleException(PuzzleErrorCode.INVALID_ASSET_DATA, "asset " + asset.getId(), e);
        }
    }

    private List<AssetAttribute> toEntities(AttributeList attributes) {
        return attributes.asList().stream()
                .map(a -> new AssetAttribute(a.getKey(), a.getValue()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private AssetResponse toResponse(PuzzleAsset asset) {
        return AssetResponse.builder()
                .id(asset.getId())
                .collectionId(asset.getCollectionId())
                .name(asset.getName())
                .uri(asset.getUri())
                .owner(asset.getOwner())
                .updateAuthority(asset.getUpdateAuthority())
                .attributes(asset.getAttributes().stream()
                        .map(a -> new AttributeDto(a.getKey(), a.getValue()))
                        .collect(Collectors.toList()))
                .createdAt(asset.getCreatedAt())
                .updatedAt(asset.getUpdatedAt())
                .build();
    }

    private CollectionResponse toResponse(PuzzleCollection collection) {
        return CollectionResponse.builder()
                .id(collection.getId())
                .name(collection.getName())
                .uri(collection.getUri())
                .updateAuthority(collection.getUpdateAuthority())
                .createdBy(collection.getCreatedBy())
                .createdAt(collection.getCreatedAt())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
