package com.wordhunt.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AdjacencyTest {

    @Test
    void centreCellHasEightNeighboursInRowThenColumnOrder() {
        List<Cell> neighbors = Adjacency.neighbors(1, 1, 3, 3);

        assertEquals(List.of(
                new Cell(0, 0), new Cell(0, 1), new Cell(0, 2),
                new Cell(1, 0), new Cell(1, 2),
                new Cell(2, 0), new Cell(2, 1), new Cell(2, 2)), neighbors);
    }

    @Test
    void cornerAndEdgeCellsAreClipped() {
        assertEquals(List.of(new Cell(0, 1), new Cell(1, 0), new Cell(1, 1)), Adjacency.neighbors(0, 0, 3, 3));
        assertEquals(5, Adjacency.neighbors(0, 1, 3, 3).size());
        assertEquals(3, Adjacency.neighbors(2, 2, 3, 3).size());
    }

    @Test
    void singleCellGridHasNoNeighbours() {
        assertTrue(Adjacency.neighbors(0, 0, 1, 1).isEmpty());
    }

    @Test
    void orthogonalModeDropsDiagonals() {
        List<Cell> neighbors = Adjacency.neighbors(1, 1, 3, 3, false);

        assertEquals(List.of(new Cell(0, 1), new Cell(1, 0), new Cell(1, 2), new Cell(2, 1)), neighbors);
    }

    @Test
    void tableMatchesNeighbourLists() {
        int[][] table = Adjacency.table(2, 3, true);

        assertEquals(6, table.length);
        assertArrayEquals(new int[] {1, 3, 4}, table[0]);
        assertArrayEquals(new int[] {0, 2, 3, 4, 5}, table[1]);
        assertArrayEquals(new int[] {1, 2, 4}, table[5]);
    }

    @Test
    void everyNeighbourIsAdjacent() {
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 5; col++) {
                Cell cell = new Cell(row, col);
                for (Cell neighbor : Adjacency.neighbors(row, col, 4, 5)) {
                    assertTrue(cell.isAdjacentTo(neighbor), cell + " -> " + neighbor);
                }
            }
        }
    }

    @Test
    void rejectsOutOfRangeCell() {
        assertThrows(IllegalArgumentException.class, () -> Adjacency.neighbors(3, 0, 3, 3));
        assertThrows(IllegalArgumentException.class, () -> Adjacency.neighbors(0, 0, 0, 3));
    }
}
