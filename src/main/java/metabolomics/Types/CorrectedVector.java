/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package metabolomics.Types;

public class CorrectedVector {

    public enum SolveMethod {EXACT, NNLS}

    public final SolveMethod method;
    public final int clippedNum;
    private final double[] unclipped;
    private final double[] intensities;

    public CorrectedVector(double[] unclipped, SolveMethod method) {
        this.unclipped = unclipped.clone();
        this.method = method;
        intensities = new double[unclipped.length];
        int clipped = 0;
        for (int i = 0; i < unclipped.length; ++i) {
            if (unclipped[i] < 0) {
                ++clipped;
            } else {
                intensities[i] = unclipped[i];
            }
        }
        clippedNum = clipped;
    }

    // negatives replaced by zero
    public double[] getIntensities() {
        return intensities.clone();
    }

    public double[] getUnclippedIntensities() {
        return unclipped.clone();
    }
}
