package com.bracketeer.repository;

import com.bracketeer.model.Stage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StageRepository extends JpaRepository<Stage, Long> {
    List<Stage> findByTournamentIdOrderByIdAsc(Long tournamentId);
}
