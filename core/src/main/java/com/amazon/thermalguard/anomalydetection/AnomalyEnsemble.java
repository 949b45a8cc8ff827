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

package com.amazon.thermalguard.anomalydetection;

import static com.amazon.thermalguard.CommonUtils.checkNotNull;
import static com.amazon.thermalguard.CommonUtils.checkState;

import lombok.extern.slf4j.Slf4j;

import com.amazon.thermalguard.returntypes.EnsembleResult;

/**
 * Combines two independent detectors; a point is an anomaly only if both flag
 * it. Batches without two distinct points are not judged at all and
 * contain no anomalies.
 */
@Slf4j
public class AnomalyEnsemble {

    private final IOutlierDetector densityDetector;

    private final IOutlierDetector boundaryDetector;

    public AnomalyEnsemble(IOutlierDetector densityDetector, IOutlierDetector boundaryDetector) {
        this.densityDetector = checkNotNull(densityDetector, "density detector must not be null");
        this.boundaryDetector = checkNotNull(boundaryDetector, "boundary detector must not be null");
    }

    public EnsembleResult evaluate(double[][] points) {
        checkNotNull(points, "points must not be null");
        if (!hasDistinctPoints(points)) {
            log.debug("no two distinct points among {}, skipping outlier detection", points.length);
            return EnsembleResult.none(points.length);
        }

        boolean[] density = densityDetector.detect(points);
        boolean[] boundary = boundaryDetector.detect(points);
        checkState(density.length == points.length && boundary.length == points.length,
                "detectors must judge every point");

        boolean[] combined = new boolean[points.length];
        for (int i = 0; i < points.length; i++) {
            combined[i] = density[i] && boundary[i];
        }
        return new EnsembleResult(combined);
    }

    /**
     * @return true if some row differs from the first one
     */
    static boolean hasDistinctPoints(double[][] points) {
        for (int i = 1; i < points.length; i++) {
            for (int j = 0; j < points[0].length; j++) {
                if (points[i][j] != points[0][j]) {
                    return true;
                }
            }
        }
        return false;
    }

    public IOutlierDetector getDensityDetector() {
        return densityDetector;
    }

    public IOutlierDetector getBoundaryDetector() {
        return boundaryDetector;
    }
}
