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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A chemical element with its stable isotopes ordered by mass number. Mass shifts are counted from the lightest
 * isotope, which is the M+0 peak of a metabolite.
 */
public class Element {

    public static final double ABUNDANCE_TOLERANCE = 1e-4;

    public final String symbol;
    private final ImmutableList<Isotope> isotopes;
    private final double[] shiftDistribution;

    public Element(String symbol, List<Isotope> isotopeList) {
        if (isotopeList.isEmpty()) {
            throw new IllegalArgumentException(String.format(Locale.US, "Element %s has no isotope.", symbol));
        }
        List<Isotope> sorted = new ArrayList<>(isotopeList);
        Collections.sort(sorted);

        double total = 0;
        for (int i = 0; i < sorted.size(); ++i) {
            Isotope isotope = sorted.get(i);
            if (isotope.abundance < 0 || Double.isNaN(isotope.abundance)) {
                throw new IllegalArgumentException(String.format(Locale.US, "Isotope %d%s has an invalid abundance %f.", isotope.massNumber, symbol, isotope.abundance));
            }
            if (i > 0 && sorted.get(i - 1).massNumber == isotope.massNumber) {
                throw new IllegalArgumentException(String.format(Locale.US, "Isotope %d%s is listed twice.", isotope.massNumber, symbol));
            }
            total += isotope.abundance;
        }
        if (Math.abs(total - 1) > ABUNDANCE_TOLERANCE) {
            throw new IllegalArgumentException(String.format(Locale.US, "Abundances of %s sum to %f instead of 1.", symbol, total));
        }

        this.symbol = symbol;
        isotopes = ImmutableList.copyOf(sorted);
        int lightest = sorted.get(0).massNumber;
        shiftDistribution = new double[sorted.get(sorted.size() - 1).massNumber - lightest + 1];
        for (Isotope isotope : sorted) {
            shiftDistribution[isotope.massNumber - lightest] = isotope.abundance;
        }
    }

    public ImmutableList<Isotope> getIsotopes() {
        return isotopes;
    }

    public int getMonoisotopicMassNumber() {
        return isotopes.get(0).massNumber;
    }

    public int massShift(Isotope isotope) {
        return isotope.massNumber - getMonoisotopicMassNumber();
    }

    // index = mass shift, value = natural abundance of one atom
    public double[] getShiftDistribution() {
        return shiftDistribution.clone();
    }

    public int hashCode() {
        return symbol.hashCode() * 31 + isotopes.hashCode();
    }

    public boolean equals(Object other) {
        if (other instanceof Element) {
            Element temp = (Element) other;
            return temp.symbol.contentEquals(symbol) && temp.isotopes.equals(isotopes);
        } else {
            return false;
        }
    }

    public String toString() {
        return symbol + isotopes.toString();
    }
}
