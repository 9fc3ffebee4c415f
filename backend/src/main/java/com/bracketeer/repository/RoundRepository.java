package com.bracketeer.repository;

import com.bracketeer.model.Round;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RoundRepository extends JpaRepository<Round, Long> {
    List<Round> findByStageItemIdOrderByIdAsc(Long stageItemId);

    List<Round> findByStageItemIdInOrderByIdAsc(Collection<Long> stageItemIds);
}
