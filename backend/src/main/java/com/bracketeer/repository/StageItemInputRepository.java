package com.bracketeer.repository;

import com.bracketeer.model.StageItemInput;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StageItemInputRepository extends JpaRepository<StageItemInput, Long> {
    List<StageItemInput> findByStageItemIdOrderBySlotAsc(Long stageItemId);
}
