package com.asi.service;

import com.asi.model.CanonicalStack;
import com.asi.model.MetricResult;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.StatisticSpec;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StatisticReducer {

    private static final Logger log = LoggerFactory.getLogger(StatisticReducer.class);

    /**
     * Recorre los frames de uno en uno sobre la máscara ya resuelta; solo se reserva un
     * buffer del tamaño de la región, nunca una copia del stack.
     */
    public MetricResult reduce(CanonicalStack stack, RegionMask mask, StatisticSpec statistic, RegionMode mode) {
        if (mask.gridHeight > stack.height || mask.gridWidth > stack.width) {
            throw new IllegalArgumentException("Region grid " + mask.gridHeight + "x" + mask.gridWidth
                    + " does not fit the " + stack.height + "x" + stack.width + " image");
        }

        int n = mask.size();
        int[] rows = new int[n];
        int[] cols = new int[n];
        for (int k = 0; k < n; k++) {
            rows[k] = mask.row(k);
            cols[k] = mask.col(k);
        }

        double[][] out = new double[stack.channels][stack.frames];
        double[] buf = new double[n];
        boolean joint = statistic.isPercentile() && !stack.isMono();
        Integer[] order = joint ? new Integer[n] : null;
        double[] sums = joint ? new double[n] : null;

        for (int f = 0; f < stack.frames; f++) {
            if (joint) {
                int pick = jointPercentilePixel(stack, rows, cols, f, statistic.percentile, order, sums);
                for (int c = 0; c < stack.channels; c++) out[c][f] = stack.value(c, rows[pick], cols[pick], f);
                continue;
            }
            for (int c = 0; c < stack.channels; c++) {
                for (int k = 0; k < n; k++) buf[k] = stack.value(c, rows[k], cols[k], f);
                out[c][f] = reduceValues(buf, statistic);
            }
        }

        log.debug("Reduced {} frames x {} channels over {} pixels with {}", stack.frames, stack.channels, n, statistic);
        return new MetricResult(mode, statistic, mask, out);
    }

    /** Reduce un conjunto de valores de un canal. Puede reordenar {@code values}. */
    static double reduceValues(double[] values, StatisticSpec statistic) {
        switch (statistic.kind) {
            case SUM:
                return sum(values);
            case MEAN:
                return sum(values) / values.length;
            case MEDIAN:
                Arrays.sort(values);
                int mid = values.length / 2;
                if (values.length % 2 == 0) return (values[mid - 1] + values[mid]) / 2.0;
                return values[mid];
            case PERCENTILE:
                Arrays.sort(values);
                return values[nearestRank(statistic.percentile, values.length)];
        }
        throw new IllegalStateException("Unhandled statistic " + statistic);
    }

    // Percentil conjunto: los píxeles se ordenan una vez por la suma de sus canales y se
    // devuelve el triplete completo del píxel elegido (se conserva el color del píxel).
    private static int jointPercentilePixel(CanonicalStack stack, int[] rows, int[] cols, int frame,
                                            double percentile, Integer[] order, double[] sums) {
        for (int k = 0; k < rows.length; k++) {
            double s = 0;
            for (int c = 0; c < stack.channels; c++) s += stack.value(c, rows[k], cols[k], frame);
            sums[k] = s;
            order[k] = k;
        }
        Arrays.sort(order, (a, b) -> Double.compare(sums[a], sums[b]));
        return order[nearestRank(percentile, rows.length)];
    }

    static int nearestRank(double percentile, int count) {
        return (int) Math.floor(percentile / 100.0 * (count - 1));
    }

    private static double sum(double[] values) {
        double s = 0;
        for (double v : values) s += v;
        return s;
    }
}
