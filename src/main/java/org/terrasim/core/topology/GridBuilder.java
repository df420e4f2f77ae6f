package org.terrasim.core.topology;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Строит сетку "12 пентов + остальные хексы" повторным делением икосаэдра.
 *
 * Работаем с двойственной триангуляцией: вершины = тайлы, треугольники = углы.
 * Шаг деления ставит новый тайл в середину каждого ребра (проекция на сферу)
 * и режет каждый треугольник на 4. Старые id тайлов не меняются.
 */
public class GridBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridBuilder.class);

    /** 10 * 4^9 + 2 = 2 621 442 тайла; дальше памяти уже не хватит. */
    public static final int MAX_LEVEL = 9;

    public Grid build(int level) {
        checkLevel(level);
        Grid grid = base();
        for (int i = 0; i < level; i++) {
            grid = subdivide(grid);
        }
        return grid;
    }

    /** G0..G_level, нужна для coarse-to-fine алгоритмов рельефа. */
    public List<Grid> buildSequence(int level) {
        checkLevel(level);
        List<Grid> grids = new ArrayList<>(level + 1);
        Grid grid = base();
        grids.add(grid);
        for (int i = 0; i < level; i++) {
            grid = subdivide(grid);
            grids.add(grid);
        }
        return Collections.unmodifiableList(grids);
    }

    /**
     * Уровень 0: вершины на полюсах оси z и два кольца по 5 на широте +-atan(1/2),
     * нижнее кольцо сдвинуто на 36 градусов.
     */
    public Grid base() {
        Vec3[] centers = new Vec3[12];
        centers[0] = new Vec3(0.0, 0.0, 1.0);
        centers[1] = new Vec3(0.0, 0.0, -1.0);

        double ringLat = Math.atan(0.5);
        for (int k = 0; k < 5; k++) {
            double upperLon = Math.toRadians(72.0 * k);
            double lowerLon = Math.toRadians(36.0 + 72.0 * k);
            centers[2 + k] = fromLatLon(ringLat, upperLon);
            centers[7 + k] = fromLatLon(-ringLat, lowerLon);
        }

        int[][] triangles = new int[20][];
        int f = 0;
        for (int k = 0; k < 5; k++) {
            int u0 = 2 + k;
            int u1 = 2 + (k + 1) % 5;
            int l0 = 7 + k;
            int l1 = 7 + (k + 1) % 5;
            triangles[f++] = new int[]{0, u0, u1};
            triangles[f++] = new int[]{u0, l0, u1};
            triangles[f++] = new int[]{u1, l0, l1};
            triangles[f++] = new int[]{1, l1, l0};
        }

        return fromTriangles(0, 0, centers, triangles, null);
    }

    public Grid subdivide(Grid grid) {
        if (grid.level() >= MAX_LEVEL) {
            throw new ConfigurationException("Subdivision level out of range: " + (grid.level() + 1)
                    + " (max " + MAX_LEVEL + ")");
        }

        int n = grid.tileCount();
        int faces = grid.cornerCount();
        int edges = n + faces - 2; // Эйлер: V - E + F = 2
        int newCount = n + edges;

        Vec3[] centers = new Vec3[newCount];
        for (int t = 0; t < n; t++) {
            centers[t] = grid.tileCenter(t);
        }
        int[][] parents = new int[edges][];

        // midpoint[a][k] - id середины ребра (a, tileNeighbor(a, k)), хранится у меньшего конца
        int[][] midpoint = new int[n][];
        for (int t = 0; t < n; t++) {
            midpoint[t] = new int[grid.tileEdgeCount(t)];
            Arrays.fill(midpoint[t], -1);
        }

        int next = n;
        int[][] triangles = new int[faces * 4][];
        int out = 0;
        for (int c = 0; c < faces; c++) {
            int a = grid.cornerTile(c, 0);
            int b = grid.cornerTile(c, 1);
            int d = grid.cornerTile(c, 2);

            int[] ids = new int[3];
            int[][] edgeEnds = {{a, b}, {b, d}, {d, a}};
            for (int e = 0; e < 3; e++) {
                int lo = Math.min(edgeEnds[e][0], edgeEnds[e][1]);
                int hi = Math.max(edgeEnds[e][0], edgeEnds[e][1]);
                int slot = neighborSlot(grid, lo, hi);
                int id = midpoint[lo][slot];
                if (id < 0) {
                    id = next++;
                    midpoint[lo][slot] = id;
                    centers[id] = centers[lo].add(centers[hi]).normalize();
                    parents[id - n] = new int[]{lo, hi};
                }
                ids[e] = id;
            }

            int mab = ids[0];
            int mbd = ids[1];
            int mda = ids[2];
            triangles[out++] = new int[]{a, mab, mda};
            triangles[out++] = new int[]{mab, b, mbd};
            triangles[out++] = new int[]{mda, mbd, d};
            triangles[out++] = new int[]{mab, mbd, mda};
        }

        if (next != newCount) {
            throw new IllegalStateException("Edge count mismatch during subdivision: have=" + (next - n)
                    + " want=" + edges);
        }

        Grid refined = fromTriangles(grid.level() + 1, n, centers, triangles, parents);
        LOGGER.debug("Subdivided grid: level={} tiles={} corners={}",
                refined.level(), refined.tileCount(), refined.cornerCount());
        return refined;
    }

    private Grid fromTriangles(int level, int previousTileCount, Vec3[] centers, int[][] triangles, int[][] parents) {
        int n = centers.length;
        int faces = triangles.length;

        for (int[] tri : triangles) {
            orientOutward(tri, centers);
        }

        // инцидентность тайл -> треугольники
        int[] degree = new int[n];
        for (int[] tri : triangles) {
            for (int v : tri) degree[v]++;
        }
        int[][] incident = new int[n][];
        for (int t = 0; t < n; t++) {
            if (degree[t] != 5 && degree[t] != 6) {
                throw new IllegalStateException("Tile id=" + t + " touches " + degree[t] + " corners");
            }
            incident[t] = new int[degree[t]];
        }
        int[] fill = new int[n];
        for (int f = 0; f < faces; f++) {
            for (int v : triangles[f]) {
                incident[v][fill[v]++] = f;
            }
        }

        int[][] tileCorners = new int[n][];
        int[][] tileNeighbors = new int[n][];
        for (int t = 0; t < n; t++) {
            orderAroundTile(t, incident[t], triangles, tileCorners, tileNeighbors);
        }

        Vec3[] cornerPositions = new Vec3[faces];
        int[][] cornerTiles = new int[faces][];
        int[][] cornerCorners = new int[faces][];
        for (int f = 0; f < faces; f++) {
            int[] tri = triangles[f];
            cornerPositions[f] = centers[tri[0]].add(centers[tri[1]]).add(centers[tri[2]]).normalize();
            cornerTiles[f] = tri.clone();
            cornerCorners[f] = new int[]{
                    acrossEdge(f, tri[0], tri[1], incident, triangles),
                    acrossEdge(f, tri[1], tri[2], incident, triangles),
                    acrossEdge(f, tri[2], tri[0], incident, triangles)
            };
        }

        return new Grid(level, previousTileCount, centers, tileCorners, tileNeighbors, parents,
                cornerPositions, cornerTiles, cornerCorners);
    }

    /**
     * Раскладываем треугольники вокруг тайла против часовой стрелки:
     * каждый треугольник поворачиваем к виду (t, u, v), следующий начинается с v.
     */
    private void orderAroundTile(int t, int[] faces, int[][] triangles, int[][] tileCorners, int[][] tileNeighbors) {
        int m = faces.length;
        int[] us = new int[m];
        int[] vs = new int[m];
        for (int i = 0; i < m; i++) {
            int[] tri = triangles[faces[i]];
            int pos = tri[0] == t ? 0 : (tri[1] == t ? 1 : 2);
            us[i] = tri[(pos + 1) % 3];
            vs[i] = tri[(pos + 2) % 3];
        }

        int[] corners = new int[m];
        int[] neighbors = new int[m];
        boolean[] used = new boolean[m];
        int current = 0;
        for (int k = 0; k < m; k++) {
            used[current] = true;
            corners[k] = faces[current];
            neighbors[k] = vs[current];
            if (k == m - 1) break;

            int following = -1;
            for (int j = 0; j < m; j++) {
                if (!used[j] && us[j] == vs[current]) {
                    following = j;
                    break;
                }
            }
            if (following < 0) {
                throw new IllegalStateException("Broken corner fan around tile id=" + t);
            }
            current = following;
        }
        if (us[0] != vs[current]) {
            throw new IllegalStateException("Corner fan does not close around tile id=" + t);
        }

        tileCorners[t] = corners;
        tileNeighbors[t] = neighbors;
    }

    private int acrossEdge(int face, int a, int b, int[][] incident, int[][] triangles) {
        for (int f : incident[a]) {
            if (f == face) continue;
            int[] tri = triangles[f];
            if (tri[0] == b || tri[1] == b || tri[2] == b) {
                return f;
            }
        }
        throw new IllegalStateException("Edge (" + a + ", " + b + ") of corner " + face + " has no opposite corner");
    }

    private int neighborSlot(Grid grid, int tile, int neighbor) {
        int count = grid.tileEdgeCount(tile);
        for (int k = 0; k < count; k++) {
            if (grid.tileNeighbor(tile, k) == neighbor) return k;
        }
        throw new IllegalStateException("Tiles " + tile + " and " + neighbor + " are not adjacent");
    }

    private void orientOutward(int[] tri, Vec3[] centers) {
        Vec3 a = centers[tri[0]];
        Vec3 b = centers[tri[1]];
        Vec3 c = centers[tri[2]];
        double side = b.sub(a).cross(c.sub(a)).dot(a.add(b).add(c));
        if (side < 0) {
            int tmp = tri[1];
            tri[1] = tri[2];
            tri[2] = tmp;
        }
    }

    private static Vec3 fromLatLon(double lat, double lon) {
        return new Vec3(
                Math.cos(lat) * Math.cos(lon),
                Math.cos(lat) * Math.sin(lon),
                Math.sin(lat)
        );
    }

    private static void checkLevel(int level) {
        if (level < 0 || level > MAX_LEVEL) {
            throw new ConfigurationException("Subdivision level out of range: " + level
                    + " (expected 0.." + MAX_LEVEL + ")");
        }
    }
}
