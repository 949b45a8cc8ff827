/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.thermalguard;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import com.amazon.thermalguard.anomalydetection.AnomalyEnsemble;
import com.amazon.thermalguard.anomalydetection.IOutlierDetector;
import com.amazon.thermalguard.anomalydetection.IsolationForestDetector;
import com.amazon.thermalguard.anomalydetection.OneClassSvmDetector;
import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.model.SensorReading;
import com.amazon.thermalguard.preprocessor.FeatureBuilder;
import com.amazon.thermalguard.preprocessor.Normalizer;
import com.amazon.thermalguard.report.ReportContext;
import com.amazon.thermalguard.report.ReportGenerator;
import com.amazon.thermalguard.returntypes.AnalysisDescriptor;
import com.amazon.thermalguard.returntypes.EnsembleResult;
import com.amazon.thermalguard.spatial.SpatialConsensus;
import com.amazon.thermalguard.statistics.ThermalStatistics;

/**
 * Analyzes a snapshot of thermal sensor telemetry and produces a single status
 * line.
 *
 * The online sensors are turned into standardized feature rows and judged by
 * two independent outlier detectors, an isolation forest and a one-class SVM.
 * A sensor is anomalous only if both detectors flag it. Anomalies that are
 * physically close to one another confirm a clustered thermal event. The
 * report policy of the requested focus turns these findings, together with the
 * temperature statistics, into the final line.
 *
 * An analyzer holds only its configuration. Every call fits its detectors
 * from scratch with the configured seed, so identical snapshots give identical
 * reports and one instance can be shared between threads.
 */
@Slf4j
public class ThermalAnalyzer {

    private final FeatureBuilder featureBuilder;

    private final AnomalyEnsemble ensemble;

    private final SpatialConsensus spatialConsensus;

    private final ReportGenerator reportGenerator;

    protected ThermalAnalyzer(Builder builder) {
        checkArgument(builder.clusterDistance > 0, "cluster distance should be positive");
        IOutlierDetector density = builder.densityDetector
                .orElseGet(() -> IsolationForestDetector.builder().numberOfTrees(builder.numberOfTrees)
                        .sampleSize(builder.sampleSize).contamination(builder.contamination)
                        .randomSeed(builder.randomSeed).build());
        IOutlierDetector boundary = builder.boundaryDetector
                .orElseGet(() -> OneClassSvmDetector.builder().nu(builder.nu).build());
        featureBuilder = new FeatureBuilder();
        ensemble = new AnomalyEnsemble(density, boundary);
        spatialConsensus = new SpatialConsensus(builder.clusterDistance);
        reportGenerator = builder.reportGenerator.orElseGet(ReportGenerator::new);
    }

    /**
     * @return a new ThermalAnalyzer builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an analyzer with the default detectors and seed
     */
    public static ThermalAnalyzer defaultAnalyzer() {
        return builder().build();
    }

    /**
     * @param request a snapshot and the focus of the report
     * @return the report line
     */
    public String analyze(AnalysisRequest request) {
        return describe(request).getReport();
    }

    /**
     * Runs the whole pipeline and keeps its intermediate results.
     *
     * @param request a snapshot and the focus of the report
     * @return the results, including the report line
     */
    public AnalysisDescriptor describe(AnalysisRequest request) {
        checkNotNull(request, "request must not be null");
        AnalysisDescriptor descriptor = new AnalysisDescriptor(request.getFocus());
        descriptor.setOfflineCount(request.getOfflineCount());

        List<SensorReading> online = featureBuilder.selectOnline(request.getSensors());
        descriptor.setOnlineCount(online.size());
        if (online.isEmpty()) {
            descriptor.setReport(ReportGenerator.NO_ONLINE_SENSORS);
            return descriptor;
        }

        double[][] features = Normalizer.fitTransform(featureBuilder.build(online));
        EnsembleResult result = ensemble.evaluate(features);
        int[] anomalyIndices = result.getAnomalyIndices();
        boolean clustered = spatialConsensus.confirm(online, anomalyIndices);
        if (clustered) {
            log.debug("{} anomalies confirmed as a spatial cluster", anomalyIndices.length);
        }
        ThermalStatistics statistics = ThermalStatistics.of(online);

        descriptor.setAnomalyIndices(anomalyIndices);
        descriptor.setClusterConfirmed(clustered);
        descriptor.setStatistics(statistics);
        descriptor.setReport(reportGenerator.generate(request.getFocus(), new ReportContext(anomalyIndices.length,
                clustered, statistics, online.size(), request.getOfflineCount())));
        return descriptor;
    }

    public AnomalyEnsemble getEnsemble() {
        return ensemble;
    }

    public SpatialConsensus getSpatialConsensus() {
        return spatialConsensus;
    }

    public static class Builder {

        private int numberOfTrees = IsolationForestDetector.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForestDetector.DEFAULT_SAMPLE_SIZE;
        private double contamination = IsolationForestDetector.DEFAULT_CONTAMINATION;
        private long randomSeed = IsolationForestDetector.DEFAULT_RANDOM_SEED;
        private double nu = OneClassSvmDetector.DEFAULT_NU;
        private double clusterDistance = SpatialConsensus.DEFAULT_DISTANCE_THRESHOLD;
        private Optional<IOutlierDetector> densityDetector = Optional.empty();
        private Optional<IOutlierDetector> boundaryDetector = Optional.empty();
        private Optional<ReportGenerator> reportGenerator = Optional.empty();

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder nu(double nu) {
            this.nu = nu;
            return this;
        }

        public Builder clusterDistance(double clusterDistance) {
            this.clusterDistance = clusterDistance;
            return this;
        }

        /**
         * replaces the isolation forest; forest parameters are then ignored
         */
        public Builder densityDetector(IOutlierDetector densityDetector) {
            this.densityDetector = Optional.of(densityDetector);
            return this;
        }

        /**
         * replaces the one-class SVM; nu is then ignored
         */
        public Builder boundaryDetector(IOutlierDetector boundaryDetector) {
            this.boundaryDetector = Optional.of(boundaryDetector);
            return this;
        }

        public Builder reportGenerator(ReportGenerator reportGenerator) {
            this.reportGenerator = Optional.of(reportGenerator);
            return this;
        }

        public ThermalAnalyzer build() {
            return new ThermalAnalyzer(this);
        }
    }
}
