package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.Planet;
import org.terrasim.core.topology.Grid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Сток по наискорейшему спуску.
 *
 * Тайл суши течёт в самого низкого соседа (при равенстве - меньший id),
 * только если тот строго ниже. Суша у берега и локальные минимумы - стоки.
 * Расход = 1 + сумма расходов всех тайлов выше по течению.
 */
public class RiverGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiverGenerator.class);

    public Planet generate(Planet planet) {
        Grid grid = planet.grid();
        int n = planet.tileCount();

        int[] target = new int[n];
        TileLoops.forEachIndex(n, t -> target[t] = downstream(planet, grid, t));

        // сверху вниз: всё, что впадает в тайл, уже посчитано
        List<Integer> land = new ArrayList<>();
        for (int t = 0; t < n; t++) {
            if (planet.isLand(t)) land.add(t);
        }
        land.sort(Comparator.comparingDouble((Integer t) -> -planet.elevation(t))
                .thenComparingInt(t -> t));

        double[] discharge = new double[n];
        for (int t : land) {
            discharge[t] += 1.0;
            if (target[t] != Planet.NO_TARGET) {
                discharge[target[t]] += discharge[t];
            }
        }

        checkDescending(planet, target);
        checkAcyclic(target);

        int sinks = 0;
        double maxDischarge = 0.0;
        for (int t : land) {
            if (target[t] == Planet.NO_TARGET) sinks++;
            maxDischarge = Math.max(maxDischarge, discharge[t]);
        }
        LOGGER.info("Rivers routed: landTiles={} sinks={} maxDischarge={}", land.size(), sinks, maxDischarge);

        return planet.withRivers(target, discharge);
    }

    static int downstream(Planet planet, Grid grid, int tile) {
        if (planet.isOcean(tile)) {
            return Planet.NO_TARGET;
        }
        int best = Planet.NO_TARGET;
        double bestElevation = Double.POSITIVE_INFINITY;
        int m = grid.tileEdgeCount(tile);
        for (int k = 0; k < m; k++) {
            int nb = grid.tileNeighbor(tile, k);
            if (planet.isOcean(nb)) {
                // устье
                return Planet.NO_TARGET;
            }
            double e = planet.elevation(nb);
            if (e < bestElevation || (e == bestElevation && nb < best)) {
                best = nb;
                bestElevation = e;
            }
        }
        return bestElevation < planet.elevation(tile) ? best : Planet.NO_TARGET;
    }

    /** Каждый шаг строго вниз. */
    static void checkDescending(Planet planet, int[] target) {
        for (int t = 0; t < target.length; t++) {
            int next = target[t];
            if (next == Planet.NO_TARGET) continue;
            if (!(planet.elevation(next) < planet.elevation(t))) {
                throw new IllegalStateException("Flow from tile id=" + t + " to id=" + next
                        + " does not descend");
            }
        }
    }

    /** Каждый путь кончается стоком не дольше чем за n шагов. */
    static void checkAcyclic(int[] target) {
        int n = target.length;
        boolean[] reachesSink = new boolean[n];
        for (int t = 0; t < n; t++) {
            int cur = t;
            int steps = 0;
            while (!reachesSink[cur] && target[cur] != Planet.NO_TARGET) {
                cur = target[cur];
                if (++steps > n) {
                    throw new IllegalStateException("Flow cycle detected starting at tile id=" + t);
                }
            }
            for (int p = t; !reachesSink[p]; p = target[p]) {
                reachesSink[p] = true;
                if (target[p] == Planet.NO_TARGET) break;
            }
        }
    }
}
