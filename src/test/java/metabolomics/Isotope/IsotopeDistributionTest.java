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

import metabolomics.Types.Element;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class IsotopeDistributionTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    public void testConvolute() {
        double[] h = IsotopeDistribution.convolute(new double[]{0.5, 0.5}, new double[]{0.9, 0.1}, 10);
        assertArrayEquals(new double[]{0.45, 0.5, 0.05}, h, TOLERANCE);

        // truncated
        h = IsotopeDistribution.convolute(new double[]{0.5, 0.5}, new double[]{0.9, 0.1}, 2);
        assertArrayEquals(new double[]{0.45, 0.5}, h, TOLERANCE);
    }

    @Test
    public void testBinomialCarbon() throws Exception {
        Element carbon = IsotopeTable.defaultTable().lookup("C");
        double p = 0.0107;
        double q = 0.9893;
        double[] d = IsotopeDistribution.ofAtoms(carbon, 3, 10);
        assertArrayEquals(new double[]{q * q * q, 3 * p * q * q, 3 * p * p * q, p * p * p}, d, TOLERANCE);
    }

    @Test
    public void testPowerMatchesRepeatedConvolution() throws Exception {
        Element oxygen = IsotopeTable.defaultTable().lookup("O");
        for (int n = 0; n <= 13; ++n) {
            double[] expected = IsotopeDistribution.TRIVIAL;
            for (int i = 0; i < n; ++i) {
                expected = IsotopeDistribution.convolute(expected, oxygen.getShiftDistribution(), 7);
            }
            assertArrayEquals("n = " + n, expected, IsotopeDistribution.ofAtoms(oxygen, n, 7), TOLERANCE);
        }
    }

    @Test
    public void testZeroAtoms() throws Exception {
        Element hydrogen = IsotopeTable.defaultTable().lookup("H");
        assertArrayEquals(new double[]{1}, IsotopeDistribution.ofAtoms(hydrogen, 0, 5), 0);
        assertEquals(1, IsotopeDistribution.TRIVIAL.length);
    }
}
