package com.statsdb.statsdb_api.repository;

import com.statsdb.statsdb_api.model.GameServer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface GameServerRepository extends JpaRepository<GameServer, Long> {

    @Query("""
        SELECT gs.handle FROM GameServer gs
        WHERE gs.handle <> ''
        GROUP BY gs.handle
        ORDER BY MAX(gs.gameId) DESC
        """)
    List<String> findHandles();

    @Query("SELECT COUNT(DISTINCT gs.handle) FROM GameServer gs WHERE gs.handle <> ''")
    long countHandles();

    @Query("""
        SELECT DISTINCT gs.gameId FROM GameServer gs
        WHERE gs.handle = :handle
        AND EXISTS (SELECT g.id FROM Game g WHERE g.id = gs.gameId)
        ORDER BY gs.gameId ASC
        """)
    List<Long> findGameIdsByHandle(@Param("handle") String handle);

    Optional<GameServer> findFirstByGameIdAndHandle(Long gameId, String handle);
}
