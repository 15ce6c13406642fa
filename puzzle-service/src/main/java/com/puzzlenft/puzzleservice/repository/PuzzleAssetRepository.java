package com.puzzlenft.puzzleservice.repository;

import com.puzzlenft.puzzleservice.entity.PuzzleAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PuzzleAssetRepository extends JpaRepository<PuzzleAsset, String> {

    List<PuzzleAsset> findByOwnerOrderByCreatedAtDesc(String owner);

    List<PuzzleAsset> findByCollectionIdOrderByCreatedAtDesc(String collectionId);
}
