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

import metabolomics.Exceptions.DimensionMismatchException;
import metabolomics.Exceptions.InvalidIntensityException;
import metabolomics.Exceptions.SingularCorrectionMatrixException;
import metabolomics.Types.CorrectedVector;
import metabolomics.Types.CorrectionMatrix;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

/**
 * Recovers the true label distribution c from observed intensities v = M^T c. The exact LU solve is used when it
 * is possible and gives a non-negative answer; otherwise the non-negative least squares solution is returned.
 * Negative entries that remain are clipped to zero by {@link CorrectedVector}.
 */
public class CorrectionSolver {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionSolver.class);

    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-11;
    public static final double DEFAULT_NEGATIVE_TOLERANCE = 1e-9;

    private final double singularityThreshold;
    private final double negativeTolerance;
    private final int nnlsMaxIterations;

    public CorrectionSolver() {
        this(DEFAULT_SINGULARITY_THRESHOLD, DEFAULT_NEGATIVE_TOLERANCE, 0);
    }

    // nnlsMaxIterations == 0 lets the NNLS solver pick a limit from the matrix size
    public CorrectionSolver(double singularityThreshold, double negativeTolerance, int nnlsMaxIterations) {
        this.singularityThreshold = singularityThreshold;
        this.negativeTolerance = negativeTolerance;
        this.nnlsMaxIterations = nnlsMaxIterations;
    }

    public CorrectedVector solve(CorrectionMatrix matrix, double[] observed) throws DimensionMismatchException, InvalidIntensityException, SingularCorrectionMatrixException {
        if (observed.length != matrix.size()) {
            throw new DimensionMismatchException(matrix.size(), observed.length);
        }
        double total = 0;
        for (int i = 0; i < observed.length; ++i) {
            if (Double.isNaN(observed[i]) || Double.isInfinite(observed[i]) || observed[i] < 0) {
                throw new InvalidIntensityException(String.format(Locale.US, "Intensity %f of label state %d is not a non-negative number.", observed[i], i));
            }
            total += observed[i];
        }

        RealMatrix a = new Array2DRowRealMatrix(matrix.toArray(), false).transpose();
        if (!isUsable(a)) {
            throw new SingularCorrectionMatrixException(String.format(Locale.US, "The correction matrix of %s (%s) is empty or not finite.", matrix.formula, matrix.tracerSpec));
        }

        DecompositionSolver luSolver = new LUDecomposition(a, singularityThreshold).getSolver();
        if (luSolver.isNonSingular()) {
            double[] exact = luSolver.solve(new ArrayRealVector(observed)).toArray();
            double limit = -negativeTolerance * Math.max(total, Double.MIN_NORMAL);
            boolean feasible = true;
            for (double v : exact) {
                if (Double.isNaN(v) || Double.isInfinite(v) || v < limit) {
                    feasible = false;
                    break;
                }
            }
            if (feasible) {
                return new CorrectedVector(exact, CorrectedVector.SolveMethod.EXACT);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Exact solution {} of {} ({}) has negative entries. Use NNLS.", Arrays.toString(exact), matrix.formula, matrix.tracerSpec);
            }
        } else {
            logger.debug("The correction matrix of {} ({}) is singular. Use NNLS.", matrix.formula, matrix.tracerSpec);
        }

        NonNegativeLeastSquares nnls = new NonNegativeLeastSquares(nnlsMaxIterations);
        return new CorrectedVector(nnls.solve(a, observed), CorrectedVector.SolveMethod.NNLS);
    }

    private static boolean isUsable(RealMatrix a) {
        boolean nonZero = false;
        for (int i = 0; i < a.getRowDimension(); ++i) {
            for (int j = 0; j < a.getColumnDimension(); ++j) {
                double v = a.getEntry(i, j);
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    return false;
                }
                if (v != 0) {
                    nonZero = true;
                }
            }
        }
        return nonZero;
    }
}
