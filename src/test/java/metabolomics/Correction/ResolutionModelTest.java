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

import metabolomics.Formula.FormulaParser;
import metabolomics.Isotope.IsotopeDistribution;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Types.CorrectionMatrix;
import metabolomics.Types.Element;
import metabolomics.Types.Formula;
import metabolomics.Types.Isotope;
import metabolomics.Types.TracerSpec;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ResolutionModelTest {

    private static final TracerSpec carbonTracer = new TracerSpec("C", 13, 1, 3);

    private IsotopeTable isotopeTable;
    private FormulaParser parser;

    @Before
    public void setUp() {
        isotopeTable = IsotopeTable.defaultTable();
        parser = new FormulaParser(isotopeTable);
    }

    @Test
    public void testResolvableMassDifference() {
        ResolutionModel orbitrap = new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 140000, 200);
        assertEquals(1.66 * Math.pow(75, 1.5) / (140000 * Math.sqrt(200)), orbitrap.resolvableMassDifference(75), 1e-15);
        ResolutionModel ftIcr = new ResolutionModel(ResolutionModel.Instrument.FT_ICR, 100000, 400);
        assertEquals(1.66 * 75 * 75 / (100000.0 * 400), ftIcr.resolvableMassDifference(75), 1e-15);
        // orbitrap peaks widen with the square root of the mass
        assertEquals(Math.pow(4, 1.5), orbitrap.resolvableMassDifference(300) / orbitrap.resolvableMassDifference(75), 1e-9);
    }

    @Test
    public void testCorrectionLimit() throws Exception {
        Element carbon = isotopeTable.lookup("C");
        Element hydrogen = isotopeTable.lookup("H");
        Element oxygen = isotopeTable.lookup("O");
        ResolutionModel model = new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 50000, 200);

        // 17O sits 0.00086 from 13C, 2H 0.0029 and 18O 0.0025 from their carbon counterparts
        assertEquals(1, model.correctionLimit(75, carbon, carbonTracer, oxygen, new Isotope(17, 0.00038)));
        assertEquals(0, model.correctionLimit(75, carbon, carbonTracer, oxygen, new Isotope(18, 0.00205)));
        assertEquals(0, model.correctionLimit(75, carbon, carbonTracer, hydrogen, new Isotope(2, 0.000115)));
        assertEquals(0, model.correctionLimit(75, carbon, carbonTracer, oxygen, new Isotope(16, 0.99757)));

        ResolutionModel lowResolution = new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 1000, 200);
        assertEquals(26, lowResolution.correctionLimit(75, carbon, carbonTracer, hydrogen, new Isotope(2, 0.000115)));
    }

    @Test
    public void testOddShiftNeverOverlapsTwoUnitTracer() throws Exception {
        Element sulfur = isotopeTable.lookup("S");
        Element oxygen = isotopeTable.lookup("O");
        TracerSpec sulfurTracer = new TracerSpec("S", 34, 2, 1);
        ResolutionModel model = new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 100, 200);
        assertEquals(0, model.correctionLimit(121, sulfur, sulfurTracer, oxygen, new Isotope(17, 0.00038)));
        assertEquals(true, model.correctionLimit(121, sulfur, sulfurTracer, oxygen, new Isotope(18, 0.00205)) > 0);
    }

    @Test
    public void testUnknownExactMass() throws Exception {
        Element iron = isotopeTable.lookup("Fe");
        ResolutionModel model = new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 10, 200);
        assertNull(model.backgroundDistribution(500, isotopeTable.lookup("C"), carbonTracer, iron, 1, 4));
    }

    @Test
    public void testHighResolutionRemovesBackground() throws Exception {
        Formula formula = parser.parse("C3H7O2");
        CorrectionMatrix resolved = new CorrectionMatrixBuilder(isotopeTable, null, new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 1e6, 200)).build(formula, carbonTracer);
        CorrectionMatrix carbonOnly = new CorrectionMatrixBuilder(isotopeTable, Collections.<String>emptySet()).build(formula, carbonTracer);
        for (int i = 0; i < resolved.size(); ++i) {
            assertArrayEquals(carbonOnly.getRow(i), resolved.getRow(i), 0);
        }
    }

    @Test
    public void testLowResolutionKeepsBackground() throws Exception {
        Formula formula = parser.parse("C3H7O2");
        // the resolution model takes precedence over the element list
        CorrectionMatrix merged = new CorrectionMatrixBuilder(isotopeTable, Collections.singleton("N"), new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 1000, 200)).build(formula, carbonTracer);
        CorrectionMatrix all = new CorrectionMatrixBuilder(isotopeTable).build(formula, carbonTracer);
        for (int i = 0; i < merged.size(); ++i) {
            assertArrayEquals(all.getRow(i), merged.getRow(i), 1e-15);
        }
    }

    @Test
    public void testPartiallyResolvedBackground() throws Exception {
        Formula formula = parser.parse("C3H7O2");
        CorrectionMatrix matrix = new CorrectionMatrixBuilder(isotopeTable, null, new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 50000, 200)).build(formula, carbonTracer);

        // only one 17O stays merged, hydrogen and 18O are resolved
        double q0 = 0.99757;
        double q1 = 0.00038;
        double[] background = new double[]{q0 * q0, 2 * q0 * q1};
        for (int i = 0; i < matrix.size(); ++i) {
            double[] distribution = IsotopeDistribution.convolute(background, IsotopeDistribution.ofAtoms(isotopeTable.lookup("C"), 3 - i, 4), 4);
            double[] expected = new double[4];
            double sum = 0;
            for (int j = i; j < 4; ++j) {
                expected[j] = distribution[j - i];
                sum += expected[j];
            }
            for (int j = i; j < 4; ++j) {
                expected[j] /= sum;
            }
            assertArrayEquals(expected, matrix.getRow(i), 1e-12);
        }
    }

    @Test
    public void testInstrumentNames() {
        assertEquals(ResolutionModel.Instrument.ORBITRAP, ResolutionModel.Instrument.parse(" Orbitrap "));
        assertEquals(ResolutionModel.Instrument.FT_ICR, ResolutionModel.Instrument.parse("ft-icr"));
        assertEquals(ResolutionModel.Instrument.FT_ICR, ResolutionModel.Instrument.parse("FTICR"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInstrument() {
        ResolutionModel.Instrument.parse("tof");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveResolution() {
        new ResolutionModel(ResolutionModel.Instrument.ORBITRAP, 0, 200);
    }
}
