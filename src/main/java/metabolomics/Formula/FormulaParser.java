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

import metabolomics.Exceptions.InvalidFormulaException;
import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Types.Formula;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses formulae such as "C3H7O2", "CH3COOH", "Ca(OH)2" or "[(CH3)3Si]2O". Counts must be positive integers,
 * groups may be nested and an element may appear more than once.
 */
public class FormulaParser {

    private final IsotopeTable isotopeTable;

    public FormulaParser(IsotopeTable isotopeTable) {
        this.isotopeTable = isotopeTable;
    }

    public Formula parse(String formulaString) throws InvalidFormulaException, UnknownElementException {
        if (formulaString == null || formulaString.trim().isEmpty()) {
            throw new InvalidFormulaException("Empty formula.");
        }
        String formula = formulaString.trim();
        Cursor cursor = new Cursor(formula);
        Map<String, Integer> elementMap = parseSequence(cursor, (char) 0);
        if (cursor.pos < formula.length()) {
            throw error(formula, cursor.pos, "unexpected character '" + formula.charAt(cursor.pos) + "'");
        }
        if (elementMap.isEmpty()) {
            throw new InvalidFormulaException(String.format(Locale.US, "Formula %s contains no element.", formula));
        }

        // syntax first, then every symbol must be known
        for (String symbol : elementMap.keySet()) {
            isotopeTable.lookup(symbol);
        }
        return new Formula(elementMap);
    }

    private Map<String, Integer> parseSequence(Cursor cursor, char closing) throws InvalidFormulaException {
        Map<String, Integer> elementMap = new TreeMap<>();
        String formula = cursor.formula;
        while (cursor.pos < formula.length()) {
            char c = formula.charAt(cursor.pos);
            if (c == '(' || c == '[') {
                int openPos = cursor.pos;
                ++cursor.pos;
                Map<String, Integer> groupMap = parseSequence(cursor, c == '(' ? ')' : ']');
                ++cursor.pos; // consume the closing bracket
                if (groupMap.isEmpty()) {
                    throw error(formula, openPos, "empty group");
                }
                int multiplier = parseCount(cursor);
                for (Map.Entry<String, Integer> entry : groupMap.entrySet()) {
                    add(elementMap, entry.getKey(), (long) entry.getValue() * multiplier, formula);
                }
            } else if (c == ')' || c == ']') {
                if (c != closing) {
                    throw error(formula, cursor.pos, "unbalanced '" + c + "'");
                }
                return elementMap;
            } else if (c >= 'A' && c <= 'Z') {
                int start = cursor.pos;
                ++cursor.pos;
                if (cursor.pos < formula.length() && Character.isLowerCase(formula.charAt(cursor.pos))) {
                    ++cursor.pos;
                }
                String symbol = formula.substring(start, cursor.pos);
                add(elementMap, symbol, parseCount(cursor), formula);
            } else {
                throw error(formula, cursor.pos, "unexpected character '" + c + "'");
            }
        }
        if (closing != 0) {
            throw error(formula, formula.length(), "missing '" + closing + "'");
        }
        return elementMap;
    }

    private int parseCount(Cursor cursor) throws InvalidFormulaException {
        String formula = cursor.formula;
        int start = cursor.pos;
        while (cursor.pos < formula.length() && Character.isDigit(formula.charAt(cursor.pos))) {
            ++cursor.pos;
        }
        if (start == cursor.pos) {
            return 1;
        }
        int count;
        try {
            count = Integer.parseInt(formula.substring(start, cursor.pos));
        } catch (NumberFormatException ex) {
            throw error(formula, start, "count is too large");
        }
        if (count == 0) {
            throw error(formula, start, "zero count");
        }
        return count;
    }

    private static void add(Map<String, Integer> elementMap, String symbol, long count, String formula) throws InvalidFormulaException {
        long total = elementMap.getOrDefault(symbol, 0) + count;
        if (total > Integer.MAX_VALUE) {
            throw new InvalidFormulaException(String.format(Locale.US, "Atom count of %s in %s is too large.", symbol, formula));
        }
        elementMap.put(symbol, (int) total);
    }

    private static InvalidFormulaException error(String formula, int pos, String reason) {
        return new InvalidFormulaException(String.format(Locale.US, "Invalid formula %s at position %d: %s.", formula, pos, reason));
    }

    private static class Cursor {

        final String formula;
        int pos = 0;

        Cursor(String formula) {
            this.formula = formula;
        }
    }
}
