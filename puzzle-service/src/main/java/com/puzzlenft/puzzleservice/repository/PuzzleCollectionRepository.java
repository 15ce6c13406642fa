package com.puzzlenft.puzzleservice.repository;

import com.puzzlenft.puzzleservice.entity.PuzzleCollection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PuzzleCollectionRepository extends JpaRepository<PuzzleCollection, String> {
}
