package com.stocktracker.kr.ledger;

import com.stocktracker.kr.capacity.OpenPositions;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.store.PortfolioStore;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-process mirror of the stored open set, ordered by ticker. Readable by anyone, writable only
 * from this package (the ledger) after the store write has committed.
 */
public final class HoldingBook implements OpenPositions {
    private final ConcurrentSkipListMap<String, Position> byTicker = new ConcurrentSkipListMap<>();

    public static HoldingBook load(PortfolioStore store) throws SQLException {
        HoldingBook book = new HoldingBook();
        for (Position position : store.loadOpenPositions()) {
            book.byTicker.put(position.ticker, position);
        }
        return book;
    }

    @Override
    public int openCount() {
        return byTicker.size();
    }

    @Override
    public List<Position> openPositions() {
        return List.copyOf(byTicker.values());
    }

    public Optional<Position> get(String ticker) {
        if (ticker == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTicker.get(ticker));
    }

    public boolean contains(String ticker) {
        return ticker != null && byTicker.containsKey(ticker);
    }

    void put(Position position) {
        byTicker.put(position.ticker, position);
    }

    void remove(String ticker) {
        byTicker.remove(ticker);
    }
}
