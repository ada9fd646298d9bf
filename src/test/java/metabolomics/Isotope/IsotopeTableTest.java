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

package metabolomics.Isotope;

import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Types.Element;
import metabolomics.Types.Isotope;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class IsotopeTableTest {

    @Test
    public void testEveryElementSumsToOne() throws Exception {
        IsotopeTable table = IsotopeTable.defaultTable();
        assertTrue(table.getSymbols().size() > 20);
        for (String symbol : table.getSymbols()) {
            double total = 0;
            for (Isotope isotope : table.lookup(symbol).getIsotopes()) {
                total += isotope.abundance;
            }
            assertEquals(symbol, 1, total, Element.ABUNDANCE_TOLERANCE);
        }
    }

    @Test
    public void testCommonElements() throws Exception {
        IsotopeTable table = IsotopeTable.defaultTable();
        assertArrayEquals(new double[]{0.9893, 0.0107}, table.lookup("C").getShiftDistribution(), 0);
        assertArrayEquals(new double[]{0.99757, 0.00038, 0.00205}, table.lookup("O").getShiftDistribution(), 0);
        assertArrayEquals(new double[]{1}, table.lookup("P").getShiftDistribution(), 0);
        assertEquals(35, table.lookup("Cl").getMonoisotopicMassNumber());
    }

    @Test
    public void testUnknownElement() {
        try {
            IsotopeTable.defaultTable().lookup("Xx");
            fail("Expected UnknownElementException");
        } catch (UnknownElementException ex) {
            assertEquals("Xx", ex.symbol);
            assertEquals("UnknownElement", ex.kind());
        }
    }

    @Test
    public void testOverrides() throws Exception {
        Map<String, List<Isotope>> overrideMap = Collections.singletonMap("C", Arrays.asList(new Isotope(12, 0.95), new Isotope(13, 0.05)));
        IsotopeTable table = IsotopeTable.defaultTable().withOverrides(overrideMap);
        assertArrayEquals(new double[]{0.95, 0.05}, table.lookup("C").getShiftDistribution(), 0);
        assertSame(IsotopeTable.defaultTable().lookup("H"), table.lookup("H"));

        // the default table is untouched
        assertArrayEquals(new double[]{0.9893, 0.0107}, IsotopeTable.defaultTable().lookup("C").getShiftDistribution(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidOverride() {
        IsotopeTable.defaultTable().withOverrides(Collections.singletonMap("C", Arrays.asList(new Isotope(12, 0.5), new Isotope(13, 0.1))));
    }
}
