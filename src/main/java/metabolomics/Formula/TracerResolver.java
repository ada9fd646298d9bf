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

package metabolomics.Formula;

import metabolomics.Exceptions.InvalidTracerSpecException;
import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Types.Element;
import metabolomics.Types.Formula;
import metabolomics.Types.Isotope;
import metabolomics.Types.TracerSpec;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a tracer identifier ("C", "C13", "13C", "N15", "O18", ...) into a {@link TracerSpec} for one formula.
 */
public class TracerResolver {

    private static final Pattern symbolFirstPattern = Pattern.compile("^([A-Z][a-z]?)(\\d*)$");
    private static final Pattern massFirstPattern = Pattern.compile("^(\\d+)([A-Z][a-z]?)$");

    private final IsotopeTable isotopeTable;

    public TracerResolver(IsotopeTable isotopeTable) {
        this.isotopeTable = isotopeTable;
    }

    public TracerSpec resolve(Formula formula, String tracer) throws InvalidTracerSpecException, UnknownElementException {
        return resolve(formula, tracer, null);
    }

    public TracerSpec resolve(Formula formula, String tracer, Integer maxLabelCount) throws InvalidTracerSpecException, UnknownElementException {
        if (tracer == null) {
            throw new InvalidTracerSpecException("No tracer is given.");
        }
        String symbol;
        int massNumber = -1;
        try {
            Matcher matcher = symbolFirstPattern.matcher(tracer.trim());
            if (matcher.matches()) {
                symbol = matcher.group(1);
                if (!matcher.group(2).isEmpty()) {
                    massNumber = Integer.valueOf(matcher.group(2));
                }
            } else {
                matcher = massFirstPattern.matcher(tracer.trim());
                if (matcher.matches()) {
                    massNumber = Integer.valueOf(matcher.group(1));
                    symbol = matcher.group(2);
                } else {
                    throw new InvalidTracerSpecException(String.format(Locale.US, "Cannot parse tracer %s.", tracer));
                }
            }
        } catch (NumberFormatException ex) {
            throw new InvalidTracerSpecException(String.format(Locale.US, "Cannot parse the mass number of tracer %s.", tracer));
        }

        Element element = isotopeTable.lookup(symbol);
        Isotope labelIsotope = massNumber < 0 ? defaultLabelIsotope(element) : findIsotope(element, massNumber);
        int atomNum = formula.getCount(symbol);
        if (atomNum == 0) {
            throw new InvalidTracerSpecException(String.format(Locale.US, "Tracer element %s is not in formula %s.", symbol, formula));
        }

        int labelNum = atomNum;
        if (maxLabelCount != null) {
            if (maxLabelCount < 0 || maxLabelCount > atomNum) {
                throw new InvalidTracerSpecException(String.format(Locale.US, "Label count %d of %s is out of range 0..%d for formula %s.", maxLabelCount, symbol, atomNum, formula));
            }
            labelNum = maxLabelCount;
        }
        return new TracerSpec(symbol, labelIsotope.massNumber, element.massShift(labelIsotope), labelNum);
    }

    // the most abundant isotope other than the monoisotopic one, e.g. 13C, 15N, 18O, 34S
    private static Isotope defaultLabelIsotope(Element element) throws InvalidTracerSpecException {
        Isotope best = null;
        for (Isotope isotope : element.getIsotopes()) {
            if (element.massShift(isotope) > 0 && (best == null || isotope.abundance > best.abundance)) {
                best = isotope;
            }
        }
        if (best == null) {
            throw new InvalidTracerSpecException(String.format(Locale.US, "Element %s has no heavy isotope to trace.", element.symbol));
        }
        return best;
    }

    private static Isotope findIsotope(Element element, int massNumber) throws InvalidTracerSpecException {
        for (Isotope isotope : element.getIsotopes()) {
            if (isotope.massNumber == massNumber) {
                if (element.massShift(isotope) == 0) {
                    throw new InvalidTracerSpecException(String.format(Locale.US, "%d%s is the monoisotopic isotope and cannot be a tracer.", massNumber, element.symbol));
                }
                return isotope;
            }
        }
        throw new InvalidTracerSpecException(String.format(Locale.US, "%d%s is not a stable isotope in the isotope table.", massNumber, element.symbol));
    }
}
