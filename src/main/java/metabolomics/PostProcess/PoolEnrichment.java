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

package metabolomics.PostProcess;

import metabolomics.Types.CorrectedVector;
import metabolomics.Types.CorrectionResult;

public class PoolEnrichment {

    public static CorrectionResult aggregate(CorrectedVector correctedVector) {
        double[] intensities = correctedVector.getIntensities();
        double poolTotal = 0;
        for (double v : intensities) {
            poolTotal += v;
        }

        // an empty pool has no enrichment, all fractions stay zero
        double[] fractionalEnrichment = new double[intensities.length];
        if (poolTotal > 0) {
            for (int i = 0; i < intensities.length; ++i) {
                fractionalEnrichment[i] = intensities[i] / poolTotal;
            }
        }
        return new CorrectionResult(correctedVector, poolTotal, fractionalEnrichment);
    }
}
