package org.terrasim.core.topology;

import java.util.Objects;

/**
 * Неизменяемая сферическая сетка уровня L.
 *
 * Правила:
 * - тайлы 0..11 - пентагоны (5 углов/соседей), остальные - гексагоны (6);
 * - каждый угол касается ровно 3 тайлов и 3 углов;
 * - tileCount(L) = 10 * 4^L + 2;
 * - id тайлов предыдущего уровня сохраняются (тайлы 0..previousTileCount-1 те же точки).
 *
 * Хранение - плоские массивы индексов, без ссылок между объектами.
 */
public final class Grid {

    private static final int[] NO_PARENTS = new int[0];

    private final int level;
    private final int previousTileCount;

    private final Vec3[] tileCenters;
    /** Углы тайла против часовой стрелки (вид снаружи). */
    private final int[][] tileCorners;
    /** Сосед k лежит между углами k и k+1. */
    private final int[][] tileNeighbors;
    /** Для тайлов, добавленных на этом уровне: два родителя (концы ребра). */
    private final int[][] tileParents;

    private final Vec3[] cornerPositions;
    private final int[][] cornerTiles;
    private final int[][] cornerCorners;

    Grid(int level,
         int previousTileCount,
         Vec3[] tileCenters,
         int[][] tileCorners,
         int[][] tileNeighbors,
         int[][] tileParents,
         Vec3[] cornerPositions,
         int[][] cornerTiles,
         int[][] cornerCorners) {
        this.level = level;
        this.previousTileCount = previousTileCount;
        this.tileCenters = tileCenters;
        this.tileCorners = tileCorners;
        this.tileNeighbors = tileNeighbors;
        this.tileParents = tileParents;
        this.cornerPositions = cornerPositions;
        this.cornerTiles = cornerTiles;
        this.cornerCorners = cornerCorners;
    }

    public static int expectedTileCount(int level) {
        return 10 * (1 << (2 * level)) + 2;
    }

    public int level() {
        return level;
    }

    public int tileCount() {
        return tileCenters.length;
    }

    public int cornerCount() {
        return cornerPositions.length;
    }

    /** Сколько тайлов было на предыдущем уровне (для уровня 0 - 0). */
    public int previousTileCount() {
        return previousTileCount;
    }

    public Vec3 tileCenter(int tile) {
        return tileCenters[checkTile(tile)];
    }

    public int tileEdgeCount(int tile) {
        return tileCorners[checkTile(tile)].length;
    }

    public int tileCorner(int tile, int index) {
        int[] corners = tileCorners[checkTile(tile)];
        return corners[Objects.checkIndex(index, corners.length)];
    }

    public int tileNeighbor(int tile, int index) {
        int[] neighbors = tileNeighbors[checkTile(tile)];
        return neighbors[Objects.checkIndex(index, neighbors.length)];
    }

    /** Копия списка соседей, порядок совпадает с tileNeighbor(tile, k). */
    public int[] tileNeighbors(int tile) {
        return tileNeighbors[checkTile(tile)].clone();
    }

    /**
     * Родители тайла на предыдущем уровне: пустой массив для тайлов,
     * унаследованных без изменений, и ровно два id для новых тайлов.
     */
    public int[] tileParents(int tile) {
        int t = checkTile(tile);
        if (t < previousTileCount || tileParents == null) {
            return NO_PARENTS;
        }
        return tileParents[t - previousTileCount].clone();
    }

    public Vec3 cornerPosition(int corner) {
        return cornerPositions[checkCorner(corner)];
    }

    public int cornerTile(int corner, int index) {
        return cornerTiles[checkCorner(corner)][Objects.checkIndex(index, 3)];
    }

    public int cornerCorner(int corner, int index) {
        return cornerCorners[checkCorner(corner)][Objects.checkIndex(index, 3)];
    }

    public int checkTile(int tile) {
        return Objects.checkIndex(tile, tileCenters.length);
    }

    public int checkCorner(int corner) {
        return Objects.checkIndex(corner, cornerPositions.length);
    }

    @Override
    public String toString() {
        return "Grid{level=" + level + ", tiles=" + tileCount() + ", corners=" + cornerCount() + "}";
    }
}
