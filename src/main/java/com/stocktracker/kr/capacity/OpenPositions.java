package com.stocktracker.kr.capacity;

import com.stocktracker.kr.model.Position;

import java.util.List;

/**
 * Read-only view of the open set.
 */
public interface OpenPositions {

    int openCount();

    List<Position> openPositions();
}
