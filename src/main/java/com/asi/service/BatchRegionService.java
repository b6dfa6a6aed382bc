package com.asi.service;

import com.asi.error.RegionMetricException;
import com.asi.model.AppConfig;
import com.asi.model.CanonicalStack;
import com.asi.model.ImageStack;
import com.asi.model.MetricResult;
import com.asi.model.RegionMode;
import com.asi.model.Skymap;
import com.asi.model.StatisticSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Muchas regiones sobre el mismo stack y skymap, en paralelo. Stack y skymap se comparten
 * sin sincronización (solo lectura); cada región construye su propia máscara.
 */
public class BatchRegionService {

    private static final Logger log = LoggerFactory.getLogger(BatchRegionService.class);

    public static class RegionRequest {
        public final RegionMode mode;
        public final double[] bounds;
        public final StatisticSpec statistic;
        public final Double altitudeKm;

        public RegionRequest(RegionMode mode, double[] bounds, StatisticSpec statistic, Double altitudeKm) {
            this.mode = mode;
            this.bounds = bounds.clone();
            this.statistic = statistic;
            this.altitudeKm = altitudeKm;
        }
    }

    private final RegionMetricService metricService;
    private final int threads;

    public BatchRegionService() {
        this(new RegionMetricService(), AppConfig.getBatchThreads());
    }

    public BatchRegionService(RegionMetricService metricService, int threads) {
        if (threads < 1) throw new IllegalArgumentException("Batch needs at least one thread, got " + threads);
        this.metricService = metricService;
        this.threads = threads;
    }

    /**
     * Resultados en el mismo orden que las peticiones. Si una región falla, el lote falla
     * con el error original de esa región.
     */
    public List<MetricResult> extractAll(ImageStack images, Skymap skymap, List<RegionRequest> requests)
            throws InterruptedException {
        CanonicalStack stack = metricService.normalize(images);
        ExecutorService exec = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, requests.size())));
        try {
            List<Future<MetricResult>> futures = new ArrayList<>();
            for (RegionRequest req : requests) {
                futures.add(exec.submit(() -> metricService.extract(stack, req.mode, req.bounds, req.statistic,
                        skymap, req.altitudeKm, false)));
            }

            List<MetricResult> results = new ArrayList<>();
            for (Future<MetricResult> f : futures) {
                try {
                    results.add(f.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RegionMetricException) throw (RegionMetricException) cause;
                    if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                    throw new IllegalStateException("Region extraction failed", cause);
                }
            }
            log.info("Batch of {} regions done on {} threads", requests.size(), threads);
            return results;
        } finally {
            exec.shutdownNow();
        }
    }
}
