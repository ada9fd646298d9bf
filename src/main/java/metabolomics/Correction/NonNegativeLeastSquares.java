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

package metabolomics.Correction;

import metabolomics.Exceptions.SingularCorrectionMatrixException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Lawson-Hanson active set method for min ||A x - b|| subject to x >= 0. The unconstrained sub-problems are solved
 * with an SVD so that rank deficient column sets still give a least squares answer.
 */
class NonNegativeLeastSquares {

    private final int maxIterations;

    NonNegativeLeastSquares(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    double[] solve(RealMatrix a, double[] b) throws SingularCorrectionMatrixException {
        int m = a.getRowDimension();
        int n = a.getColumnDimension();
        int iterationLimit = maxIterations > 0 ? maxIterations : 30 * n;
        RealVector bVector = new ArrayRealVector(b);
        // the gradient scales with both ||A|| and ||b||
        double tolerance = 10 * Precision.EPSILON * a.getNorm() * FastMath.max(bVector.getNorm(), 1) * Math.max(m, n);

        double[] x = new double[n];
        boolean[] passive = new boolean[n];
        boolean[] rejected = new boolean[n];
        RealVector w = gradient(a, bVector, x);
        int iteration = 0;

        while (true) {
            int best = -1;
            for (int j = 0; j < n; ++j) {
                if (!passive[j] && !rejected[j] && w.getEntry(j) > tolerance && (best < 0 || w.getEntry(j) > w.getEntry(best))) {
                    best = j;
                }
            }
            if (best < 0) {
                break;
            }
            passive[best] = true;
            double[] z = solvePassive(a, bVector, passive);
            if (z[best] <= 0) {
                // rounding made the gradient look positive, skip this column until x moves
                passive[best] = false;
                rejected[best] = true;
                continue;
            }

            while (true) {
                if (++iteration > iterationLimit) {
                    throw new SingularCorrectionMatrixException(String.format(Locale.US, "Non-negative least squares did not converge in %d iterations.", iterationLimit));
                }
                double alpha = Double.POSITIVE_INFINITY;
                for (int j = 0; j < n; ++j) {
                    if (passive[j] && z[j] <= 0) {
                        double denominator = x[j] - z[j];
                        alpha = FastMath.min(alpha, denominator > 0 ? x[j] / denominator : 0);
                    }
                }
                if (alpha == Double.POSITIVE_INFINITY) {
                    x = z;
                    break;
                }
                for (int j = 0; j < n; ++j) {
                    x[j] += alpha * (z[j] - x[j]);
                    if (passive[j] && x[j] <= tolerance) {
                        passive[j] = false;
                        x[j] = 0;
                    }
                }
                z = solvePassive(a, bVector, passive);
            }
            Arrays.fill(rejected, false);
            w = gradient(a, bVector, x);
        }
        return x;
    }

    // A^T (b - A x)
    private static RealVector gradient(RealMatrix a, RealVector b, double[] x) {
        return a.transpose().operate(b.subtract(a.operate(new ArrayRealVector(x))));
    }

    private static double[] solvePassive(RealMatrix a, RealVector b, boolean[] passive) {
        List<Integer> columnList = new ArrayList<>(passive.length);
        for (int j = 0; j < passive.length; ++j) {
            if (passive[j]) {
                columnList.add(j);
            }
        }
        double[] z = new double[passive.length];
        if (columnList.isEmpty()) {
            return z;
        }
        int[] rows = new int[a.getRowDimension()];
        for (int i = 0; i < rows.length; ++i) {
            rows[i] = i;
        }
        int[] columns = new int[columnList.size()];
        for (int k = 0; k < columns.length; ++k) {
            columns[k] = columnList.get(k);
        }
        RealVector solution = new SingularValueDecomposition(a.getSubMatrix(rows, columns)).getSolver().solve(b);
        for (int k = 0; k < columns.length; ++k) {
            z[columns[k]] = solution.getEntry(k);
        }
        return z;
    }
}
