package com.bracketeer.repository;

import com.bracketeer.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MatchRepository extends JpaRepository<Match, Long> {
    List<Match> findByRoundIdInOrderByIdAsc(Collection<Long> roundIds);

    boolean existsByRoundIdIn(Collection<Long> roundIds);
}
