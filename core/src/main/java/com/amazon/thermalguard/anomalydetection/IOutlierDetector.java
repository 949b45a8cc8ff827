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

/**
 * An unsupervised outlier detector over a batch of points. A detector is
 * fitted on the points it is asked to judge and keeps nothing between calls,
 * so two calls with the same points return the same verdicts.
 */
public interface IOutlierDetector {

    /**
     * Fits the detector on the given points and judges each of them.
     *
     * @param points rows of equal length; at least two distinct rows
     * @return one verdict per row, true if the row is an outlier
     */
    boolean[] detect(double[][] points);
}
