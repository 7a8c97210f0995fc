package com.marketterminal.market_terminal.repository;

import com.marketterminal.market_terminal.model.entity.WatchlistStock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WatchlistStockRepository extends JpaRepository<WatchlistStock, Long> {

    // Members of a watchlist in the order they were added
    List<WatchlistStock> findByWatchlistIdOrderByAddedAtAscIdAsc(Long watchlistId);

    boolean existsByWatchlistIdAndSymbol(Long watchlistId, String symbol);

    long countByWatchlistId(Long watchlistId);

    @Modifying
    @Query("DELETE FROM WatchlistStock s WHERE s.watchlist.id = :watchlistId AND s.symbol = :symbol")
    int deleteByWatchlistIdAndSymbol(@Param("watchlistId") Long watchlistId, @Param("symbol") String symbol);

    // Insert a membership unless the (watchlist, symbol) pair already exists
    @Modifying
    @Query(value = "INSERT INTO watchlist_stocks (watchlist_id, symbol, added_at) " +
            "SELECT CAST(:watchlistId AS BIGINT), CAST(:symbol AS VARCHAR(20)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM watchlist_stocks WHERE watchlist_id = :watchlistId AND symbol = :symbol)",
            nativeQuery = true)
    int insertIfAbsent(@Param("watchlistId") Long watchlistId, @Param("symbol") String symbol);
}
