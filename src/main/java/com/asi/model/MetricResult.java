package com.asi.model;

public final class MetricResult {

    public final RegionMode mode;
    public final StatisticSpec statistic;
    public final int pixelCount;
    private final double[][] values; // [canal][frame]
    private final RegionMask mask;

    public MetricResult(RegionMode mode, StatisticSpec statistic, RegionMask mask, double[][] values) {
        this.mode = mode;
        this.statistic = statistic;
        this.mask = mask;
        this.pixelCount = mask.size();
        this.values = values;
    }

    public int channels() {
        return values.length;
    }

    public int frames() {
        return values[0].length;
    }

    /** 1 para mono ([frames]), 2 para color ([canales, frames]). */
    public int rank() {
        return channels() == 1 ? 1 : 2;
    }

    public double get(int channel, int frame) {
        return values[channel][frame];
    }

    public double[] mono() {
        if (rank() != 1) throw new IllegalStateException("Result has " + channels() + " channels, use channel(int)");
        return values[0].clone();
    }

    public double[] channel(int channel) {
        return values[channel].clone();
    }

    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int c = 0; c < values.length; c++) copy[c] = values[c].clone();
        return copy;
    }

    /** Máscara usada para el cálculo; el resultado no depende de ella. */
    public RegionMask mask() {
        return mask;
    }
}
