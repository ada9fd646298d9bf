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

import metabolomics.Correction.CorrectionMatrixBuilder;
import metabolomics.Correction.CorrectionMatrixCache;
import metabolomics.Correction.CorrectionSolver;
import metabolomics.Exceptions.InvalidIntensityException;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Parameter.Parameter;
import metabolomics.Types.CorrectionResult;
import metabolomics.Types.SampleGroup;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class NACorrTest {

    private NACorr naCorr;

    @Before
    public void setUp() {
        IsotopeTable isotopeTable = IsotopeTable.defaultTable();
        naCorr = new NACorr(isotopeTable, new CorrectionMatrixCache(new CorrectionMatrixBuilder(isotopeTable)), new CorrectionSolver(), 4);
    }

    @Test
    public void testCorrectOneGroup() throws Exception {
        CorrectionResult result = naCorr.correct(new SampleGroup("lactate", "s1", "C3H7O2", "C", new double[]{100, 20, 5, 1}));
        assertArrayEquals(new double[]{103.86670163077423, 17.05438929329554, 4.215215911644017, 0.8636931642861974}, result.getCorrectedIntensities(), 1e-6);
        assertEquals(126, result.poolTotal, 1e-6);
        assertEquals(103.86670163077423 / 126, result.getFractionalEnrichment()[0], 1e-8);
    }

    @Test(expected = InvalidIntensityException.class)
    public void testCorrectOneGroupFailure() throws Exception {
        naCorr.correct(new SampleGroup("lactate", "s1", "C3H7O2", "C", new double[]{100, -20, 5, 1}));
    }

    @Test
    public void testBatchContinuesAfterFailures() throws Exception {
        List<SampleGroup> groupList = new ArrayList<>();
        groupList.add(new SampleGroup("lactate", "s1", "C3H7O2", "C", new double[]{100, 20, 5, 1}));
        groupList.add(new SampleGroup("unknown", "s1", "Xx2", "C", new double[]{1, 2, 3}));
        groupList.add(new SampleGroup("lactate", "s2", "C3H7O2", "C", new double[]{50, 50, 0, 0}));
        groupList.add(new SampleGroup("lactate", "s3", "C3H7O2", "N", new double[]{1, 2}));
        groupList.add(new SampleGroup("lactate", "s4", "C3H7O2", "C", new double[]{1, 2}));
        groupList.add(new SampleGroup("lactate", "s5", "C3H7O2", "C", new double[]{1, Double.NaN, 0, 0}));
        groupList.add(new SampleGroup("lactate", "s6", "C3H(7O2", "C", new double[]{1, 2, 3, 4}));
        groupList.add(new SampleGroup("glucose", "s1", "C6H12O6", "C", 2, new double[]{900, 80, 20}));

        NACorr.BatchResult batchResult = naCorr.correctAll(groupList);
        assertEquals(3, batchResult.getSuccessList().size());
        assertEquals(5, batchResult.getFailureList().size());

        Map<String, String> failureKindMap = new HashMap<>();
        for (NACorrWrap.Entry entry : batchResult.getFailureList()) {
            failureKindMap.put(entry.group.getId(), entry.failure.kind());
        }
        assertEquals("UnknownElement", failureKindMap.get("unknown@s1"));
        assertEquals("InvalidTracerSpec", failureKindMap.get("lactate@s3"));
        assertEquals("DimensionMismatch", failureKindMap.get("lactate@s4"));
        assertEquals("InvalidIntensity", failureKindMap.get("lactate@s5"));
        assertEquals("InvalidFormula", failureKindMap.get("lactate@s6"));

        Map<String, CorrectionResult> resultMap = batchResult.getResultMap();
        assertEquals(3, resultMap.size());
        assertTrue(resultMap.containsKey("lactate@s1"));
        assertTrue(resultMap.containsKey("lactate@s2"));
        assertEquals(3, resultMap.get("glucose@s1").getCorrectedIntensities().length);
        assertArrayEquals(new double[]{103.86670163077423, 17.05438929329554, 4.215215911644017, 0.8636931642861974}, resultMap.get("lactate@s1").getCorrectedIntensities(), 1e-6);

        // lactate with carbon tracer and glucose with two labels
        assertEquals(2, naCorr.getMatrixCache().size());
    }

    @Test
    public void testAtomCountOverflowStaysInItsGroup() throws Exception {
        List<SampleGroup> groupList = new ArrayList<>();
        groupList.add(new SampleGroup("lactate", "s1", "C3H7O2", "C", new double[]{100, 20, 5, 1}));
        groupList.add(new SampleGroup("huge", "s1", "C3(H65536)32769", "C", new double[]{1, 2, 3, 4}));
        groupList.add(new SampleGroup("huge", "s2", "C3(H65536)65536O2", "C", new double[]{1, 2, 3, 4}));

        NACorr.BatchResult batchResult = naCorr.correctAll(groupList);
        assertEquals(1, batchResult.getSuccessList().size());
        assertEquals(2, batchResult.getFailureList().size());
        for (NACorrWrap.Entry entry : batchResult.getFailureList()) {
            assertEquals("InvalidFormula", entry.failure.kind());
        }
    }

    @Test
    public void testDimensionMismatchBuildsNoMatrix() throws Exception {
        NACorr.BatchResult batchResult = naCorr.correctAll(Arrays.asList(new SampleGroup("coa", "s1", "C21H36N7O16P3S", "C", new double[]{1, 2, 3})));
        assertEquals("DimensionMismatch", batchResult.getFailureList().get(0).failure.kind());
        assertEquals(0, naCorr.getMatrixCache().size());
        assertEquals(0, naCorr.getMatrixCache().missCount());
    }

    @Test
    public void testEmptyBatch() throws Exception {
        NACorr.BatchResult batchResult = naCorr.correctAll(new ArrayList<SampleGroup>());
        assertTrue(batchResult.getSuccessList().isEmpty());
        assertTrue(batchResult.getFailureList().isEmpty());
    }

    @Test
    public void testParameterDrivenSetup() throws Exception {
        Parameter parameter = new Parameter(new File(NACorrTest.class.getResource("/test.def").toURI()).getAbsolutePath());
        NACorr configured = new NACorr(parameter);
        assertEquals(2, configured.getThreadNum());

        // overridden carbon abundance and no sulfur background
        CorrectionResult result = configured.correct(new SampleGroup("carbon disulfide", "s1", "CS2", "C", new double[]{95, 15}));
        assertArrayEquals(new double[]{100, 10}, result.getCorrectedIntensities(), 1e-9);

        NACorr.BatchResult batchResult = configured.correctAll(Arrays.asList(new SampleGroup("carbon disulfide", "s1", "CS2", "C", new double[]{95, 15}), new SampleGroup("carbon disulfide", "s2", "CS2", "C", new double[]{19, 1})));
        assertEquals(2, batchResult.getSuccessList().size());
        assertArrayEquals(new double[]{20, 0}, batchResult.getResultMap().get("carbon disulfide@s2").getCorrectedIntensities(), 1e-9);
    }
}
