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

package metabolomics.Isotope;

import metabolomics.Types.Element;

/**
 * Discrete mass-shift distributions. Index k holds the probability of k extra mass units. All operations truncate
 * their result to a fixed length because shifts only accumulate upward.
 */
public class IsotopeDistribution {

    public static final double[] TRIVIAL = new double[]{1};

    // distribution of the total shift of atomNum independent atoms of the element
    public static double[] ofAtoms(Element element, int atomNum, int length) {
        return ofAtoms(element.getShiftDistribution(), atomNum, length);
    }

    public static double[] ofAtoms(double[] shiftDistribution, int atomNum, int length) {
        return power(shiftDistribution, atomNum, length);
    }

    static double[] power(double[] f, int n, int length) {
        double[] result = TRIVIAL.clone();
        double[] base = truncate(f, length);
        while (n > 0) {
            if ((n & 1) != 0) {
                result = convolute(result, base, length);
            }
            n >>= 1;
            if (n > 0) {
                base = convolute(base, base, length);
            }
        }
        return result;
    }

    public static double[] convolute(double[] g, double[] f, int length) {
        int gN = g.length;
        int fN = f.length;
        if (gN == 0 || fN == 0) {
            return new double[0];
        }
        double[] h = new double[Math.min(gN + fN - 1, length)];
        for (int k = 0; k < h.length; ++k) {
            double sumWeight = 0;
            int start = Math.max(0, k - fN + 1);
            int end = Math.min(gN - 1, k);
            for (int i = start; i <= end; ++i) {
                sumWeight += g[i] * f[k - i];
            }
            h[k] = sumWeight;
        }
        return h;
    }

    private static double[] truncate(double[] f, int length) {
        if (f.length <= length) {
            return f.clone();
        }
        double[] h = new double[length];
        System.arraycopy(f, 0, h, 0, length);
        return h;
    }
}
