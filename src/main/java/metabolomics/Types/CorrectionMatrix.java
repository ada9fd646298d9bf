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

import java.util.Locale;

/**
 * Entry (i, j) is the probability that a molecule with i tracer labels is observed in label channel j. Each row
 * sums to one unless the row could not be normalised, in which case it is all zero.
 */
public class CorrectionMatrix {

    public final Formula formula;
    public final TracerSpec tracerSpec;
    private final double[][] entries;

    public CorrectionMatrix(Formula formula, TracerSpec tracerSpec, double[][] entries) {
        int size = tracerSpec.stateNum();
        if (entries.length != size) {
            throw new IllegalArgumentException(String.format(Locale.US, "Expected %d rows but got %d.", size, entries.length));
        }
        this.formula = formula;
        this.tracerSpec = tracerSpec;
        this.entries = new double[size][];
        for (int i = 0; i < size; ++i) {
            if (entries[i].length != size) {
                throw new IllegalArgumentException(String.format(Locale.US, "Row %d has %d columns instead of %d.", i, entries[i].length, size));
            }
            this.entries[i] = entries[i].clone();
        }
    }

    public int size() {
        return entries.length;
    }

    public double getEntry(int trueState, int observedState) {
        return entries[trueState][observedState];
    }

    public double[] getRow(int trueState) {
        return entries[trueState].clone();
    }

    public double rowSum(int trueState) {
        double sum = 0;
        for (double v : entries[trueState]) {
            sum += v;
        }
        return sum;
    }

    public double[][] toArray() {
        double[][] copy = new double[entries.length][];
        for (int i = 0; i < entries.length; ++i) {
            copy[i] = entries[i].clone();
        }
        return copy;
    }

    // observed = M^T * true
    public double[] forward(double[] trueIntensities) {
        if (trueIntensities.length != entries.length) {
            throw new IllegalArgumentException(String.format(Locale.US, "Expected %d intensities but got %d.", entries.length, trueIntensities.length));
        }
        double[] observed = new double[entries.length];
        for (int i = 0; i < entries.length; ++i) {
            for (int j = 0; j < entries.length; ++j) {
                observed[j] += entries[i][j] * trueIntensities[i];
            }
        }
        return observed;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder(entries.length * entries.length * 10);
        sb.append(formula).append(" ").append(tracerSpec).append("\n");
        for (double[] row : entries) {
            for (int j = 0; j < row.length; ++j) {
                if (j > 0) {
                    sb.append("\t");
                }
                sb.append(String.format(Locale.US, "%.6f", row[j]));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
