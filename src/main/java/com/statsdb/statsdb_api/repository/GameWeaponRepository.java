package com.statsdb.statsdb_api.repository;

import com.statsdb.statsdb_api.model.GameWeapon;
import com.statsdb.statsdb_api.service.GameFilter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;

public interface GameWeaponRepository extends JpaRepository<GameWeapon, Long>, GameWeaponRepositoryCustom {

    /** Primary plus secondary damage dealt by a handle over the given games. */
    @Query(value = """
        SELECT COALESCE(SUM(gw.damage1), 0) + COALESCE(SUM(gw.damage2), 0)
        FROM game_weapons gw JOIN games g ON g.id = gw.game_id
        WHERE gw.player_handle = :handle
        AND gw.game_id IN (:gameIds)
        """ + GameRepository.RULESET_FILTER, nativeQuery = true)
    Long sumDamage(@Param("handle") String handle,
                   @Param("gameIds") Collection<Long> gameIds,
                   @Param("filter") GameFilter filter);
}
