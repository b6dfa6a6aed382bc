package com.asi.model;

import com.asi.error.ValidationException;
import java.util.Locale;

public final class StatisticSpec {

    public enum Kind { MEDIAN, MEAN, SUM, PERCENTILE }

    public static final StatisticSpec MEDIAN = new StatisticSpec(Kind.MEDIAN, Double.NaN);
    public static final StatisticSpec MEAN = new StatisticSpec(Kind.MEAN, Double.NaN);
    public static final StatisticSpec SUM = new StatisticSpec(Kind.SUM, Double.NaN);

    public final Kind kind;
    public final double percentile; // NaN salvo para PERCENTILE

    private StatisticSpec(Kind kind, double percentile) {
        this.kind = kind;
        this.percentile = percentile;
    }

    public static StatisticSpec percentile(double p) {
        if (!(p > 0 && p < 100)) {
            throw new ValidationException("Percentile must lie strictly inside (0, 100), got " + p);
        }
        return new StatisticSpec(Kind.PERCENTILE, p);
    }

    public static StatisticSpec metric(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "median": return MEDIAN;
            case "mean": return MEAN;
            case "sum": return SUM;
            case "percentile":
                throw new ValidationException("Metric 'percentile' needs a percentile value in (0, 100)");
            default:
                throw new ValidationException("Unrecognized metric '" + name + "', expected one of [median, mean, sum]");
        }
    }

    /**
     * Combina los dos selectores mutuamente excluyentes. Sin ninguno se usa la mediana;
     * un percentil solo convive con la métrica por defecto.
     */
    public static StatisticSpec resolve(String metric, Double percentile) {
        if (percentile == null) {
            return (metric == null || metric.trim().isEmpty()) ? MEDIAN : metric(metric);
        }
        if (metric != null && !metric.trim().isEmpty()) {
            String key = metric.trim().toLowerCase(Locale.ROOT);
            if (!key.equals("median") && !key.equals("percentile")) {
                throw new ValidationException("Conflicting statistic selectors: metric '" + metric
                        + "' and percentile " + percentile + " are mutually exclusive");
            }
        }
        return percentile(percentile);
    }

    public boolean isPercentile() {
        return kind == Kind.PERCENTILE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatisticSpec)) return false;
        StatisticSpec other = (StatisticSpec) o;
        return kind == other.kind && Double.compare(percentile, other.percentile) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Double.hashCode(percentile);
    }

    @Override
    public String toString() {
        return isPercentile() ? "percentile(" + percentile + ")" : kind.name().toLowerCase(Locale.ROOT);
    }
}
