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

import com.google.common.collect.ImmutableSet;
import metabolomics.Exceptions.InvalidTracerSpecException;
import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Isotope.IsotopeDistribution;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Types.CorrectionMatrix;
import metabolomics.Types.Element;
import metabolomics.Types.Formula;
import metabolomics.Types.TracerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the natural abundance correction matrix of one (formula, tracer) pair.
 *
 * <p>The non-tracer elements give one background shift distribution D that does not depend on the label state.
 * Row i additionally carries the natural abundance of the (count - i) tracer atoms that are not labelled. Label
 * channel j is read at mass shift j * labelShift. Mass that falls beyond the last channel is dropped and every row
 * is renormalised to one. With a {@link ResolutionModel} only the isotopes the instrument cannot separate from the
 * tracer enter D.
 */
public class CorrectionMatrixBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionMatrixBuilder.class);

    private final IsotopeTable isotopeTable;
    private final ImmutableSet<String> backgroundElements;
    private final ResolutionModel resolutionModel;

    public CorrectionMatrixBuilder(IsotopeTable isotopeTable) {
        this(isotopeTable, null, null);
    }

    // backgroundElements == null folds in every non-tracer element of the formula
    public CorrectionMatrixBuilder(IsotopeTable isotopeTable, Collection<String> backgroundElements) {
        this(isotopeTable, backgroundElements, null);
    }

    // a resolution model replaces the background element list
    public CorrectionMatrixBuilder(IsotopeTable isotopeTable, Collection<String> backgroundElements, ResolutionModel resolutionModel) {
        this.isotopeTable = isotopeTable;
        this.backgroundElements = backgroundElements == null ? null : ImmutableSet.copyOf(backgroundElements);
        this.resolutionModel = resolutionModel;
    }

    public CorrectionMatrix build(Formula formula, TracerSpec tracerSpec) throws UnknownElementException, InvalidTracerSpecException {
        int tracerNum = formula.getCount(tracerSpec.element);
        if (tracerNum == 0) {
            throw new InvalidTracerSpecException(String.format(Locale.US, "Tracer element %s is not in formula %s.", tracerSpec.element, formula));
        }
        if (tracerSpec.maxLabelCount > tracerNum) {
            throw new InvalidTracerSpecException(String.format(Locale.US, "Label count %d exceeds the %d %s atoms of formula %s.", tracerSpec.maxLabelCount, tracerNum, tracerSpec.element, formula));
        }

        int stateNum = tracerSpec.stateNum();
        int length = tracerSpec.maxLabelCount * tracerSpec.labelShift + 1;
        Element tracerElement = isotopeTable.lookup(tracerSpec.element);
        double[] background = backgroundDistribution(formula, tracerSpec, tracerElement, length);

        double[][] entries = new double[stateNum][stateNum];
        for (int i = 0; i < stateNum; ++i) {
            double[] distribution = IsotopeDistribution.convolute(background, IsotopeDistribution.ofAtoms(tracerElement, tracerNum - i, length), length);
            double rowSum = 0;
            for (int j = i; j < stateNum; ++j) {
                int shift = (j - i) * tracerSpec.labelShift;
                if (shift < distribution.length) {
                    entries[i][j] = distribution[shift];
                    rowSum += entries[i][j];
                }
            }
            if (rowSum > 0) {
                for (int j = i; j < stateNum; ++j) {
                    entries[i][j] /= rowSum;
                }
            } else {
                logger.warn("Row {} of the correction matrix of {} ({}) has no probability mass.", i, formula, tracerSpec);
            }
        }
        return new CorrectionMatrix(formula, tracerSpec, entries);
    }

    double[] backgroundDistribution(Formula formula, TracerSpec tracerSpec, Element tracerElement, int length) throws UnknownElementException {
        double metaboliteMass = 0;
        for (Map.Entry<String, Integer> entry : formula.getElementCounts().entrySet()) {
            metaboliteMass += (double) entry.getValue() * isotopeTable.lookup(entry.getKey()).getMonoisotopicMassNumber();
        }

        double[] background = IsotopeDistribution.TRIVIAL.clone();
        for (Map.Entry<String, Integer> entry : formula.getElementCounts().entrySet()) {
            String symbol = entry.getKey();
            if (symbol.contentEquals(tracerSpec.element) || entry.getValue() == 0) {
                continue;
            }
            Element element = isotopeTable.lookup(symbol);
            double[] distribution;
            if (resolutionModel != null) {
                distribution = resolutionModel.backgroundDistribution(metaboliteMass, tracerElement, tracerSpec, element, entry.getValue(), length);
                if (distribution == null) {
                    logger.debug("{} of {} is resolved from {} with {}.", symbol, formula, tracerSpec, resolutionModel);
                    continue;
                }
            } else if (backgroundElements != null && !backgroundElements.contains(symbol)) {
                continue;
            } else {
                distribution = IsotopeDistribution.ofAtoms(element, entry.getValue(), length);
            }
            background = IsotopeDistribution.convolute(background, distribution, length);
        }
        return background;
    }
}
