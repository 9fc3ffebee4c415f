package com.bracketeer.repository;

import com.bracketeer.model.StageItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface StageItemRepository extends JpaRepository<StageItem, Long> {
    List<StageItem> findByStageIdInOrderByIdAsc(Collection<Long> stageIds);
}
