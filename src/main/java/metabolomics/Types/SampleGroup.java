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

/**
 * Observed isotopologue intensities of one metabolite in one sample, indexed by the number of labelled atoms.
 */
public class SampleGroup {

    public final String metabolite;
    public final String sample;
    public final String formula;
    public final String tracer;
    public final Integer maxLabelCount;
    private final double[] observedIntensities;
    private final String id;

    public SampleGroup(String metabolite, String sample, String formula, String tracer, double[] observedIntensities) {
        this(metabolite, sample, formula, tracer, null, observedIntensities);
    }

    // maxLabelCount == null means every tracer atom in the formula can be labelled.
    public SampleGroup(String metabolite, String sample, String formula, String tracer, Integer maxLabelCount, double[] observedIntensities) {
        this.metabolite = metabolite;
        this.sample = sample;
        this.formula = formula;
        this.tracer = tracer;
        this.maxLabelCount = maxLabelCount;
        this.observedIntensities = observedIntensities.clone();
        id = metabolite + "@" + sample;
    }

    public double[] getObservedIntensities() {
        return observedIntensities.clone();
    }

    public String getId() {
        return id;
    }

    public String toString() {
        return id;
    }
}
