package org.terrasim.core.terrain;

import org.terrasim.core.model.config.TerrainParameters;

import java.util.List;
import java.util.Objects;

/**
 * Варианты дерева выражений рельефа. Каждый узел - чистая функция от контекста.
 */
public final class TerrainExpressions {

    private TerrainExpressions() {}

    public static TerrainExpression constant(double value) {
        return new Constant(value);
    }

    public static TerrainExpression heightmap(Integer octaves, Double magnitude, Double persistence, long seedOffset) {
        return new Heightmap(octaves, magnitude, persistence, seedOffset);
    }

    public static TerrainExpression lower(double threshold, TerrainExpression source) {
        return new Lower(threshold, source);
    }

    public static TerrainExpression overlay(TerrainExpression continent, TerrainExpression mountain) {
        return new Overlay(continent, mountain);
    }

    public static TerrainExpression scale(double factor, TerrainExpression source) {
        return new Scale(factor, source);
    }

    public static TerrainExpression sum(List<TerrainExpression> terms) {
        return new Sum(terms);
    }

    /** Одинаковая высота на всех тайлах. */
    public static final class Constant implements TerrainExpression {
        public final double value;

        Constant(double value) {
            this.value = value;
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            double[] out = new double[ctx.tileCount()];
            java.util.Arrays.fill(out, value);
            return out;
        }
    }

    /**
     * Базовый coarse-to-fine алгоритм. Незаданные поля берутся из TerrainParameters.
     */
    public static final class Heightmap implements TerrainExpression {
        public final Integer octaves;
        public final Double magnitude;
        public final Double persistence;
        public final long seedOffset;

        Heightmap(Integer octaves, Double magnitude, Double persistence, long seedOffset) {
            this.octaves = octaves;
            this.magnitude = magnitude;
            this.persistence = persistence;
            this.seedOffset = seedOffset;
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            TerrainParameters p = Objects.requireNonNull(ctx.parameters(), "terrain parameters");
            HeightmapGenerator gen = new HeightmapGenerator(
                    p.seed + seedOffset,
                    octaves != null ? octaves : p.octaveCount,
                    magnitude != null ? magnitude : p.magnitude,
                    persistence != null ? persistence : p.persistence
            );
            return gen.generate(ctx.grids());
        }
    }

    public static final class Lower implements TerrainExpression {
        public final double threshold;
        public final TerrainExpression source;

        Lower(double threshold, TerrainExpression source) {
            this.threshold = threshold;
            this.source = Objects.requireNonNull(source, "source");
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            return TerrainOps.elevationLower(threshold, source.evaluate(ctx));
        }
    }

    /** Континент + горы по правилу TerrainOps.overlay. */
    public static final class Overlay implements TerrainExpression {
        public final TerrainExpression continent;
        public final TerrainExpression mountain;

        Overlay(TerrainExpression continent, TerrainExpression mountain) {
            this.continent = Objects.requireNonNull(continent, "continent");
            this.mountain = Objects.requireNonNull(mountain, "mountain");
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            return TerrainOps.overlay(continent.evaluate(ctx), mountain.evaluate(ctx));
        }
    }

    public static final class Scale implements TerrainExpression {
        public final double factor;
        public final TerrainExpression source;

        Scale(double factor, TerrainExpression source) {
            this.factor = factor;
            this.source = Objects.requireNonNull(source, "source");
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            return TerrainOps.scale(factor, source.evaluate(ctx));
        }
    }

    public static final class Sum implements TerrainExpression {
        public final List<TerrainExpression> terms;

        Sum(List<TerrainExpression> terms) {
            if (terms == null || terms.isEmpty()) {
                throw new IllegalArgumentException("sum needs at least one term");
            }
            this.terms = List.copyOf(terms);
        }

        @Override
        public double[] evaluate(TerrainContext ctx) {
            double[] out = new double[ctx.tileCount()];
            for (TerrainExpression term : terms) {
                double[] values = term.evaluate(ctx);
                for (int i = 0; i < out.length; i++) {
                    out[i] += values[i];
                }
            }
            return out;
        }
    }
}
