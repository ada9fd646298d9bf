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

package metabolomics;

import metabolomics.Correction.CorrectionMatrixCache;
import metabolomics.Correction.CorrectionSolver;
import metabolomics.Exceptions.CorrectionException;
import metabolomics.Exceptions.DimensionMismatchException;
import metabolomics.Formula.FormulaParser;
import metabolomics.Formula.TracerResolver;
import metabolomics.PostProcess.PoolEnrichment;
import metabolomics.Types.*;

import java.util.concurrent.Callable;

public class NACorrWrap implements Callable<NACorrWrap.Entry> {

    private final FormulaParser formulaParser;
    private final TracerResolver tracerResolver;
    private final CorrectionMatrixCache matrixCache;
    private final CorrectionSolver solver;
    private final SampleGroup group;

    public NACorrWrap(FormulaParser formulaParser, TracerResolver tracerResolver, CorrectionMatrixCache matrixCache, CorrectionSolver solver, SampleGroup group) {
        this.formulaParser = formulaParser;
        this.tracerResolver = tracerResolver;
        this.matrixCache = matrixCache;
        this.solver = solver;
        this.group = group;
    }

    @Override
    public Entry call() {
        try {
            return new Entry(group, correct(), null);
        } catch (CorrectionException ex) {
            return new Entry(group, null, ex);
        }
    }

    CorrectionResult correct() throws CorrectionException {
        Formula formula = formulaParser.parse(group.formula);
        TracerSpec tracerSpec = tracerResolver.resolve(formula, group.tracer, group.maxLabelCount);
        double[] observed = group.getObservedIntensities();
        if (observed.length != tracerSpec.stateNum()) {
            throw new DimensionMismatchException(tracerSpec.stateNum(), observed.length);
        }
        CorrectionMatrix matrix = matrixCache.get(formula, tracerSpec);
        CorrectedVector correctedVector = solver.solve(matrix, observed);
        return PoolEnrichment.aggregate(correctedVector);
    }

    public static class Entry {

        public final SampleGroup group;
        public final CorrectionResult result;
        public final CorrectionException failure;

        Entry(SampleGroup group, CorrectionResult result, CorrectionException failure) {
            this.group = group;
            this.result = result;
            this.failure = failure;
        }

        public boolean isSuccess() {
            return failure == null;
        }
    }
}
