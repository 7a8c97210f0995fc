package com.marketterminal.market_terminal.repository;

import com.marketterminal.market_terminal.dto.WatchlistSummaryDto;
import com.marketterminal.market_terminal.model.entity.Watchlist;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WatchlistRepository extends JpaRepository<Watchlist, Long> {

    // Every watchlist with its member count, empty ones included
    @Query("SELECT new com.marketterminal.market_terminal.dto.WatchlistSummaryDto(w.id, w.name, COUNT(s.id)) " +
            "FROM Watchlist w LEFT JOIN WatchlistStock s ON s.watchlist.id = w.id " +
            "GROUP BY w.id, w.name ORDER BY w.id ASC")
    List<WatchlistSummaryDto> findAllSummaries();

    // Insert a watchlist with a fixed id unless that id is already taken
    @Modifying
    @Query(value = "INSERT INTO watchlists (id, name, created_at) " +
            "SELECT CAST(:id AS BIGINT), CAST(:name AS VARCHAR(100)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM watchlists WHERE id = :id)",
            nativeQuery = true)
    int insertIfAbsent(@Param("id") Long id, @Param("name") String name);
}
