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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Types.Element;
import metabolomics.Types.Isotope;

import java.util.*;

/**
 * Natural abundances of the stable isotopes, from the CRC Handbook of Chemistry and Physics (83rd ed., 2002).
 * Tables are immutable. {@link #withOverrides(Map)} derives a new table with user supplied abundances.
 */
public class IsotopeTable {

    private static final IsotopeTable defaultTable = new IsotopeTable(buildDefaultMap());

    private final ImmutableMap<String, Element> elementMap;

    public IsotopeTable(Map<String, Element> elementMap) {
        this.elementMap = ImmutableMap.copyOf(elementMap);
    }

    public static IsotopeTable defaultTable() {
        return defaultTable;
    }

    public Element lookup(String symbol) throws UnknownElementException {
        Element element = elementMap.get(symbol);
        if (element == null) {
            throw new UnknownElementException(symbol);
        }
        return element;
    }

    public ImmutableSet<String> getSymbols() {
        return elementMap.keySet();
    }

    public IsotopeTable withOverrides(Map<String, List<Isotope>> overrideMap) {
        if (overrideMap.isEmpty()) {
            return this;
        }
        Map<String, Element> newMap = new HashMap<>(elementMap);
        for (Map.Entry<String, List<Isotope>> entry : overrideMap.entrySet()) {
            newMap.put(entry.getKey(), new Element(entry.getKey(), entry.getValue()));
        }
        return new IsotopeTable(newMap);
    }

    private static Map<String, Element> buildDefaultMap() {
        Map<String, Element> elementMap = new HashMap<>();
        Isotope[] isotopeArray;

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(1, 0.999885);
        isotopeArray[1] = new Isotope(2, 0.000115);
        elementMap.put("H", new Element("H", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(6, 0.0759);
        isotopeArray[1] = new Isotope(7, 0.9241);
        elementMap.put("Li", new Element("Li", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(10, 0.199);
        isotopeArray[1] = new Isotope(11, 0.801);
        elementMap.put("B", new Element("B", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(12, 0.9893);
        isotopeArray[1] = new Isotope(13, 0.0107);
        elementMap.put("C", new Element("C", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(14, 0.99632);
        isotopeArray[1] = new Isotope(15, 0.00368);
        elementMap.put("N", new Element("N", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[3];
        isotopeArray[0] = new Isotope(16, 0.99757);
        isotopeArray[1] = new Isotope(17, 0.00038);
        isotopeArray[2] = new Isotope(18, 0.00205);
        elementMap.put("O", new Element("O", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(19, 1.0);
        elementMap.put("F", new Element("F", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(23, 1.0);
        elementMap.put("Na", new Element("Na", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[3];
        isotopeArray[0] = new Isotope(24, 0.7899);
        isotopeArray[1] = new Isotope(25, 0.1);
        isotopeArray[2] = new Isotope(26, 0.1101);
        elementMap.put("Mg", new Element("Mg", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(27, 1.0);
        elementMap.put("Al", new Element("Al", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[3];
        isotopeArray[0] = new Isotope(28, 0.922297);
        isotopeArray[1] = new Isotope(29, 0.046832);
        isotopeArray[2] = new Isotope(30, 0.030872);
        elementMap.put("Si", new Element("Si", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(31, 1.0);
        elementMap.put("P", new Element("P", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[4];
        isotopeArray[0] = new Isotope(32, 0.9493);
        isotopeArray[1] = new Isotope(33, 0.0076);
        isotopeArray[2] = new Isotope(34, 0.0429);
        isotopeArray[3] = new Isotope(36, 0.0002);
        elementMap.put("S", new Element("S", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(35, 0.7578);
        isotopeArray[1] = new Isotope(37, 0.2422);
        elementMap.put("Cl", new Element("Cl", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[3];
        isotopeArray[0] = new Isotope(39, 0.932581);
        isotopeArray[1] = new Isotope(40, 0.000117);
        isotopeArray[2] = new Isotope(41, 0.067302);
        elementMap.put("K", new Element("K", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[6];
        isotopeArray[0] = new Isotope(40, 0.96941);
        isotopeArray[1] = new Isotope(42, 0.00647);
        isotopeArray[2] = new Isotope(43, 0.00135);
        isotopeArray[3] = new Isotope(44, 0.02086);
        isotopeArray[4] = new Isotope(46, 4e-05);
        isotopeArray[5] = new Isotope(48, 0.00187);
        elementMap.put("Ca", new Element("Ca", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(55, 1.0);
        elementMap.put("Mn", new Element("Mn", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[4];
        isotopeArray[0] = new Isotope(54, 0.05845);
        isotopeArray[1] = new Isotope(56, 0.91754);
        isotopeArray[2] = new Isotope(57, 0.02119);
        isotopeArray[3] = new Isotope(58, 0.00282);
        elementMap.put("Fe", new Element("Fe", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(59, 1.0);
        elementMap.put("Co", new Element("Co", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[5];
        isotopeArray[0] = new Isotope(58, 0.680769);
        isotopeArray[1] = new Isotope(60, 0.262231);
        isotopeArray[2] = new Isotope(61, 0.011399);
        isotopeArray[3] = new Isotope(62, 0.036345);
        isotopeArray[4] = new Isotope(64, 0.009256);
        elementMap.put("Ni", new Element("Ni", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(63, 0.6917);
        isotopeArray[1] = new Isotope(65, 0.3083);
        elementMap.put("Cu", new Element("Cu", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[5];
        isotopeArray[0] = new Isotope(64, 0.4863);
        isotopeArray[1] = new Isotope(66, 0.279);
        isotopeArray[2] = new Isotope(67, 0.041);
        isotopeArray[3] = new Isotope(68, 0.1875);
        isotopeArray[4] = new Isotope(70, 0.0062);
        elementMap.put("Zn", new Element("Zn", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[6];
        isotopeArray[0] = new Isotope(74, 0.0089);
        isotopeArray[1] = new Isotope(76, 0.0937);
        isotopeArray[2] = new Isotope(77, 0.0763);
        isotopeArray[3] = new Isotope(78, 0.2377);
        isotopeArray[4] = new Isotope(80, 0.4961);
        isotopeArray[5] = new Isotope(82, 0.0873);
        elementMap.put("Se", new Element("Se", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[2];
        isotopeArray[0] = new Isotope(79, 0.5069);
        isotopeArray[1] = new Isotope(81, 0.4931);
        elementMap.put("Br", new Element("Br", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[7];
        isotopeArray[0] = new Isotope(92, 0.1484);
        isotopeArray[1] = new Isotope(94, 0.0925);
        isotopeArray[2] = new Isotope(95, 0.1592);
        isotopeArray[3] = new Isotope(96, 0.1668);
        isotopeArray[4] = new Isotope(97, 0.0955);
        isotopeArray[5] = new Isotope(98, 0.2413);
        isotopeArray[6] = new Isotope(100, 0.0963);
        elementMap.put("Mo", new Element("Mo", Arrays.asList(isotopeArray)));

        isotopeArray = new Isotope[1];
        isotopeArray[0] = new Isotope(127, 1.0);
        elementMap.put("I", new Element("I", Arrays.asList(isotopeArray)));
        return elementMap;
    }
}
