package com.asi.service;

import com.asi.model.BoundarySpec;
import com.asi.model.CanonicalStack;
import com.asi.model.CoordinateGrid;
import com.asi.model.ImageStack;
import com.asi.model.MetricResult;
import com.asi.model.RegionMask;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;
import com.asi.model.StatisticSpec;
import com.asi.preview.ImageJPreviewRenderer;
import com.asi.preview.PreviewRenderer;
import com.asi.service.region.RegionStrategies;
import com.asi.service.region.RegionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Punto de entrada: métrica por frame (y canal) de una región del cielo o del detector.
 * Sin estado entre llamadas; el stack y el skymap solo se leen.
 */
public class RegionMetricService {

    private static final Logger log = LoggerFactory.getLogger(RegionMetricService.class);

    private final ChannelNormalizer normalizer = new ChannelNormalizer();
    private final BoundaryValidator validator = new BoundaryValidator();
    private final SkymapCoordinateResolver resolver = new SkymapCoordinateResolver();
    private final RegionMaskBuilder maskBuilder = new RegionMaskBuilder();
    private final StatisticReducer reducer = new StatisticReducer();
    private final PreviewRenderer previewRenderer;

    public RegionMetricService() {
        this(new ImageJPreviewRenderer());
    }

    public RegionMetricService(PreviewRenderer previewRenderer) {
        this.previewRenderer = previewRenderer;
    }

    public MetricResult extract(ImageStack images, String mode, double[] bounds, String metric, Double percentile,
                                Skymap skymap, Double altitudeKm, boolean showPreview) {
        RegionMode regionMode = RegionMode.parse(mode);
        StatisticSpec statistic = StatisticSpec.resolve(metric, percentile);
        return extract(images, regionMode, bounds, statistic, skymap, altitudeKm, showPreview);
    }

    public MetricResult extract(ImageStack images, RegionMode mode, double[] bounds, StatisticSpec statistic,
                                Skymap skymap, Double altitudeKm, boolean showPreview) {
        return extract(normalizer.normalize(images), mode, bounds, statistic, skymap, altitudeKm, showPreview);
    }

    public MetricResult extract(CanonicalStack stack, RegionMode mode, double[] bounds, StatisticSpec statistic,
                                Skymap skymap, Double altitudeKm, boolean showPreview) {
        RegionMask mask = locate(stack, mode, bounds, skymap, altitudeKm);
        if (showPreview) previewRenderer.render(stack, mask, mode);

        MetricResult result = reducer.reduce(stack, mask, statistic, mode);
        log.info("Extracted {} over {} {} pixels from {}", statistic, mask.size(), mode.label(), stack);
        return result;
    }

    /** Valida, resuelve coordenadas y construye la máscara, sin reducir nada. */
    public RegionMask locate(CanonicalStack stack, RegionMode mode, double[] bounds, Skymap skymap, Double altitudeKm) {
        RegionStrategy strategy = RegionStrategies.forMode(mode, resolver);
        BoundarySpec spec = validator.validate(strategy, bounds, stack);
        CoordinateGrid grid = strategy.resolve(spec, skymap, altitudeKm, stack);
        return maskBuilder.build(strategy, spec, grid);
    }

    public CanonicalStack normalize(ImageStack images) {
        return normalizer.normalize(images);
    }
}
