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

import com.google.common.collect.ImmutableMap;
import metabolomics.Isotope.IsotopeDistribution;
import metabolomics.Types.Element;
import metabolomics.Types.Isotope;
import metabolomics.Types.TracerSpec;

import java.util.Locale;
import java.util.Map;

/**
 * Decides which natural isotopes the instrument cannot separate from the tracer isotope. Two peaks with the same
 * nominal shift are merged when their mass difference is below the peak width at the metabolite mass, so only those
 * isotopes belong in the natural abundance background. The width follows the resolving power of the instrument,
 * which is given at a reference m/z.
 */
public class ResolutionModel {

    public enum Instrument {
        ORBITRAP, FT_ICR;

        public static Instrument parse(String name) {
            String temp = name.trim().toLowerCase(Locale.US).replace("-", "").replace("_", "");
            if (temp.contentEquals("orbitrap")) {
                return ORBITRAP;
            } else if (temp.contentEquals("fticr")) {
                return FT_ICR;
            } else {
                throw new IllegalArgumentException(String.format(Locale.US, "Unknown instrument %s. Expected orbitrap or ft-icr.", name));
            }
        }
    }

    // full width at half maximum to the width at which two peaks are separated
    private static final double PEAK_WIDTH_FACTOR = 1.66;

    private static final Map<String, Double> exactMassMap = ImmutableMap.<String, Double>builder()
            .put("1H", 1.00782503207)
            .put("2H", 2.0141017778)
            .put("12C", 12.0)
            .put("13C", 13.0033548378)
            .put("14N", 14.0030740048)
            .put("15N", 15.0001088982)
            .put("16O", 15.99491461956)
            .put("17O", 16.99913170)
            .put("18O", 17.9991610)
            .put("28Si", 27.9769265325)
            .put("29Si", 28.976494700)
            .put("30Si", 29.97377017)
            .put("32S", 31.97207100)
            .put("33S", 32.97145876)
            .put("34S", 33.96786690)
            .put("36S", 35.96708076)
            .put("35Cl", 34.96885268)
            .put("37Cl", 36.96590259)
            .put("79Br", 78.9183371)
            .put("81Br", 80.9162906)
            .build();

    public final Instrument instrument;
    public final double resolution;
    public final double resolutionMz;

    public ResolutionModel(Instrument instrument, double resolution, double resolutionMz) {
        if (!(resolution > 0) || !(resolutionMz > 0) || Double.isInfinite(resolution) || Double.isInfinite(resolutionMz)) {
            throw new IllegalArgumentException(String.format(Locale.US, "Resolution %f at m/z %f must be positive.", resolution, resolutionMz));
        }
        this.instrument = instrument;
        this.resolution = resolution;
        this.resolutionMz = resolutionMz;
    }

    // smallest mass difference the instrument separates at the given mass
    public double resolvableMassDifference(double mass) {
        if (instrument == Instrument.ORBITRAP) {
            return PEAK_WIDTH_FACTOR * Math.pow(mass, 1.5) / (resolution * Math.sqrt(resolutionMz));
        } else {
            return PEAK_WIDTH_FACTOR * mass * mass / (resolution * resolutionMz);
        }
    }

    /**
     * Number of atoms of the isotope that can be present before the summed mass defect becomes resolvable from the
     * tracer. 0 means the isotope is always resolved, or that its exact mass is not known.
     */
    public int correctionLimit(double metaboliteMass, Element tracerElement, TracerSpec tracerSpec, Element element, Isotope isotope) {
        int shift = element.massShift(isotope);
        if (shift == 0 || shift % tracerSpec.labelShift != 0) {
            return 0;
        }
        Double tracerMass = exactMassMap.get(tracerSpec.labelMassNumber + tracerElement.symbol);
        Double tracerMonoMass = exactMassMap.get(tracerElement.getMonoisotopicMassNumber() + tracerElement.symbol);
        Double isotopeMass = exactMassMap.get(isotope.massNumber + element.symbol);
        Double monoMass = exactMassMap.get(element.getMonoisotopicMassNumber() + element.symbol);
        if (tracerMass == null || tracerMonoMass == null || isotopeMass == null || monoMass == null) {
            return 0;
        }
        double massDifference = Math.abs((isotopeMass - monoMass) - (shift / tracerSpec.labelShift) * (tracerMass - tracerMonoMass));
        if (massDifference == 0) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Math.floor(resolvableMassDifference(metaboliteMass) / massDifference), Integer.MAX_VALUE);
    }

    /**
     * Shift distribution of atomNum atoms of a background element keeping only the isotopes that overlap the tracer,
     * or null if every heavy isotope of the element is resolved.
     */
    public double[] backgroundDistribution(double metaboliteMass, Element tracerElement, TracerSpec tracerSpec, Element element, int atomNum, int length) {
        double[] shiftDistribution = element.getShiftDistribution();
        double[] kept = new double[shiftDistribution.length];
        kept[0] = shiftDistribution[0];
        int atomLimit = Integer.MAX_VALUE;
        int maxShift = 0;
        for (Isotope isotope : element.getIsotopes()) {
            int limit = correctionLimit(metaboliteMass, tracerElement, tracerSpec, element, isotope);
            if (limit > 0) {
                int shift = element.massShift(isotope);
                kept[shift] = isotope.abundance;
                atomLimit = Math.min(atomLimit, limit);
                maxShift = Math.max(maxShift, shift);
            }
        }
        if (maxShift == 0) {
            return null;
        }
        // at most atomLimit unresolved atoms stay merged with the tracer peaks
        int elementLength = (int) Math.min(length, (long) atomLimit * maxShift + 1);
        return IsotopeDistribution.ofAtoms(kept, atomNum, elementLength);
    }

    public String toString() {
        return String.format(Locale.US, "%s resolution %.0f at m/z %.0f", instrument, resolution, resolutionMz);
    }
}
