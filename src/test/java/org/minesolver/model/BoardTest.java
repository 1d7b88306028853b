package org.minesolver.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class BoardTest {

    // ------------------------------------------------------------
    // create()
    // ------------------------------------------------------------
    @ParameterizedTest
    @CsvSource({
            "5, 5, 1, 42",
            "9, 9, 10, 7",
            "30, 16, 99, 1",
            "16, 30, 200, 123",
            "5, 5, 9, 3"
    })
    void create_placesExactlyMineCount_outsideCorners(int cols, int rows, int mines, long seed) {
        Board b = new Board(new GameSettings(cols, rows, mines, seed));

        List<Cell> placed = b.mineCells();
        assertThat(placed).hasSize(mines);
        for (Cell c : placed) {
            assertThat(GameSettings.inCornerZone(c.col(), c.row(), cols, rows))
                    .as("mine at %s", c).isFalse();
        }
        // les quatre coins 2x2, case par case
        for (int dc = 0; dc < 2; dc++) {
            for (int dr = 0; dr < 2; dr++) {
                assertThat(b.isMine(dc, dr)).isFalse();
                assertThat(b.isMine(cols - 1 - dc, dr)).isFalse();
                assertThat(b.isMine(dc, rows - 1 - dr)).isFalse();
                assertThat(b.isMine(cols - 1 - dc, rows - 1 - dr)).isFalse();
            }
        }
        assertThat(b.getRemainingSafeCells()).isEqualTo(cols * rows - mines);
        assertThat(b.getFlagsRemaining()).isEqualTo(mines);
        assertThat(b.isLost()).isFalse();
    }

    @Test
    void neighborCounts_matchDirectRecomputation() {
        Board b = new Board(new GameSettings(20, 12, 60, 11L));

        int total = 0;
        int expectedTotal = 0;
        for (int c = 0; c < 20; c++) {
            for (int r = 0; r < 12; r++) {
                int n = 0;
                for (int dc = -1; dc <= 1; dc++) {
                    for (int dr = -1; dr <= 1; dr++) {
                        if ((dc != 0 || dr != 0) && b.inBounds(c + dc, r + dr) && b.isMine(c + dc, r + dr)) n++;
                    }
                }
                assertThat(b.neighborMineCount(c, r)).as("count at (%d, %d)", c, r).isEqualTo(n);
                total += b.neighborMineCount(c, r);
            }
        }
        // chaque mine ajoute 1 à chacune de ses voisines dans la grille
        for (Cell m : b.mineCells()) {
            for (int dc = -1; dc <= 1; dc++) {
                for (int dr = -1; dr <= 1; dr++) {
                    if ((dc != 0 || dr != 0) && b.inBounds(m.col() + dc, m.row() + dr)) expectedTotal++;
                }
            }
        }
        assertThat(total).isEqualTo(expectedTotal);
    }

    @Test
    void sameSeed_sameMine_onFiveByFive() {
        GameSettings s = new GameSettings(5, 5, 1, 2024L);

        List<Cell> first = new Board(s).mineCells();
        for (int i = 0; i < 5; i++) {
            assertThat(new Board(s).mineCells()).isEqualTo(first);
        }
        Cell mine = first.get(0);
        // seules la colonne et la ligne du milieu sont hors des coins
        assertThat(mine.col() == 2 || mine.row() == 2).isTrue();
    }

    @Test
    void create_again_drawsReproducibleSequence() {
        GameSettings s = new GameSettings(12, 12, 20, 99L);
        Board a = new Board(s);
        Board b = new Board(s);

        a.create();
        b.create();

        assertThat(a.mineCells()).isEqualTo(b.mineCells());
    }

    @Test
    void create_resetsState() {
        Board b = new Board(new GameSettings(6, 6, 2, 5L));
        b.flag(0, 0);
        b.reveal(0, 5);

        b.create();

        assertThat(b.isFlagged(0, 0)).isFalse();
        assertThat(b.isRevealed(0, 5)).isFalse();
        assertThat(b.getFlagsRemaining()).isEqualTo(2);
        assertThat(b.getRemainingSafeCells()).isEqualTo(34);
    }

    // ------------------------------------------------------------
    // reveal()
    // ------------------------------------------------------------
    @Test
    void reveal_numberedCell_exposesOnlyThatCell() {
        Board b = new Board(new GameSettings(10, 10, 15, 8L));
        Cell target = find(b, (c, r) -> !b.isMine(c, r) && b.neighborMineCount(c, r) > 0);

        List<Reveal> out = b.reveal(target.col(), target.row());

        assertThat(out).containsExactly(new Reveal(target.col(), target.row(), b.neighborMineCount(target.col(), target.row())));
        assertThat(b.getRemainingSafeCells()).isEqualTo(84);
    }

    @Test
    void reveal_zeroCell_exposesConnectedRegionAndItsBorder() {
        Board b = new Board(new GameSettings(20, 20, 40, 3L));
        Cell start = find(b, (c, r) -> !b.isMine(c, r) && b.neighborMineCount(c, r) == 0);

        List<Reveal> out = b.reveal(start.col(), start.row());

        Set<Cell> expected = floodFill(b, start);
        Set<Cell> got = new HashSet<>();
        for (Reveal r : out) {
            assertThat(r.isLoss()).isFalse();
            assertThat(b.isMine(r.col(), r.row())).isFalse();
            assertThat(r.count()).isEqualTo(b.neighborMineCount(r.col(), r.row()));
            got.add(r.cell());
        }
        assertThat(got).hasSize(out.size()); // aucune case renvoyée deux fois
        assertThat(got).isEqualTo(expected);
        assertThat(b.getRemainingSafeCells()).isEqualTo(400 - 40 - out.size());
        assertThat(b.isLost()).isFalse();
    }

    @Test
    void reveal_withoutMines_clearsWholeBoard() {
        Board b = new Board(new GameSettings(4, 4, 0, 1L));

        List<Reveal> out = b.reveal(0, 0);

        assertThat(out).hasSize(16).allMatch(r -> r.count() == 0);
        assertThat(b.hasWon()).isTrue();
    }

    @Test
    void reveal_sameCellTwice_secondCallIsEmpty() {
        Board b = new Board(new GameSettings(8, 8, 6, 4L));

        assertThat(b.reveal(0, 0)).isNotEmpty();
        int remaining = b.getRemainingSafeCells();

        assertThat(b.reveal(0, 0)).isEmpty();
        assertThat(b.reveal(0, 0)).isEmpty();
        assertThat(b.getRemainingSafeCells()).isEqualTo(remaining);
    }

    @Test
    void reveal_flaggedCell_isNoOp_andCascadeSkipsIt() {
        Board b = new Board(new GameSettings(6, 6, 0, 1L));
        b.flag(3, 3);

        assertThat(b.reveal(3, 3)).isEmpty();
        List<Reveal> out = b.reveal(0, 0);

        assertThat(out).hasSize(35);
        assertThat(b.isRevealed(3, 3)).isFalse();
        assertThat(b.hasWon()).isFalse();
        assertThat(b.getRemainingSafeCells()).isEqualTo(1);
    }

    @Test
    void reveal_mine_losesAndFreezesBoard() {
        Board b = new Board(new GameSettings(7, 7, 5, 17L));
        Cell mine = b.mineCells().get(0);
        Cell safe = find(b, (c, r) -> !b.isMine(c, r));
        int remaining = b.getRemainingSafeCells();

        List<Reveal> out = b.reveal(mine.col(), mine.row());

        assertThat(out).containsExactly(new Reveal(mine.col(), mine.row(), Reveal.LOSS));
        assertThat(out.get(0).isLoss()).isTrue();
        assertThat(b.isLost()).isTrue();

        assertThat(b.reveal(safe.col(), safe.row())).isEmpty();
        assertThat(b.reveal(mine.col(), mine.row())).isEmpty();
        b.flag(safe.col(), safe.row());
        assertThat(b.isFlagged(safe.col(), safe.row())).isFalse();
        assertThat(b.getFlagsRemaining()).isEqualTo(5);
        assertThat(b.getRemainingSafeCells()).isEqualTo(remaining);
    }

    @Test
    void reveal_outOfBounds_throws() {
        Board b = new Board(new GameSettings(5, 5, 1, 1L));

        assertThatThrownBy(() -> b.reveal(5, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> b.reveal(0, -1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> b.flag(-1, 2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void hasWon_onceEverySafeCellIsRevealed() {
        Board b = new Board(new GameSettings(6, 5, 4, 21L));
        assertThat(b.hasWon()).isFalse();
        for (int c = 0; c < 6; c++) {
            for (int r = 0; r < 5; r++) {
                if (!b.isMine(c, r)) b.reveal(c, r);
            }
        }
        assertThat(b.hasWon()).isTrue();
        assertThat(b.getRemainingSafeCells()).isZero();
        assertThat(b.isLost()).isFalse();
    }

    // ------------------------------------------------------------
    // flag()
    // ------------------------------------------------------------
    @Test
    void flag_toggles_andRestoresCounter() {
        Board b = new Board(new GameSettings(5, 5, 2, 1L));

        b.flag(2, 2);
        assertThat(b.isFlagged(2, 2)).isTrue();
        assertThat(b.getFlagsRemaining()).isEqualTo(1);

        b.flag(2, 2);
        assertThat(b.isFlagged(2, 2)).isFalse();
        assertThat(b.getFlagsRemaining()).isEqualTo(2);
    }

    @Test
    void flag_revealedCell_isNoOp() {
        Board b = new Board(new GameSettings(5, 5, 2, 1L));
        b.reveal(0, 0);

        b.flag(0, 0);

        assertThat(b.isFlagged(0, 0)).isFalse();
        assertThat(b.getFlagsRemaining()).isEqualTo(2);
    }

    @Test
    void flag_overFlagging_goesNegative() {
        Board b = new Board(new GameSettings(5, 5, 1, 1L));

        b.flag(0, 0);
        b.flag(0, 1);
        b.flag(1, 0);

        assertThat(b.getFlagsRemaining()).isEqualTo(-2);
    }

    // ------------------------------------------------------------
    // utilitaires
    // ------------------------------------------------------------
    private interface CellPredicate {
        boolean test(int col, int row);
    }

    private static Cell find(Board b, CellPredicate p) {
        for (int c = 0; c < b.getColumns(); c++) {
            for (int r = 0; r < b.getRows(); r++) {
                if (p.test(c, r)) return new Cell(c, r);
            }
        }
        throw new AssertionError("no matching cell on this board");
    }

    /** Zone de zéros atteinte depuis start, plus sa bordure numérotée. */
    private static Set<Cell> floodFill(Board b, Cell start) {
        Set<Cell> seen = new HashSet<>();
        Deque<Cell> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            Cell cur = queue.poll();
            if (b.neighborMineCount(cur.col(), cur.row()) != 0) continue;
            for (int dc = -1; dc <= 1; dc++) {
                for (int dr = -1; dr <= 1; dr++) {
                    Cell n = new Cell(cur.col() + dc, cur.row() + dr);
                    if (!b.inBounds(n.col(), n.row()) || b.isMine(n.col(), n.row())) continue;
                    if (seen.add(n)) queue.add(n);
                }
            }
        }
        return seen;
    }
}
