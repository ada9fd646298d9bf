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

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.TreeMap;

public class Formula {

    private final ImmutableSortedMap<String, Integer> elementCounts;
    private final String hillString;
    private final int hashCode;

    public Formula(Map<String, Integer> elementCounts) {
        for (Map.Entry<String, Integer> entry : elementCounts.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Negative atom count for " + entry.getKey());
            }
        }
        this.elementCounts = ImmutableSortedMap.copyOf(elementCounts);
        hillString = toHillString(this.elementCounts);
        hashCode = this.elementCounts.hashCode();
    }

    public ImmutableSortedMap<String, Integer> getElementCounts() {
        return elementCounts;
    }

    public int getCount(String symbol) {
        return elementCounts.getOrDefault(symbol, 0);
    }

    public int hashCode() {
        return hashCode;
    }

    public boolean equals(Object other) {
        if (other instanceof Formula) {
            Formula temp = (Formula) other;
            return temp.elementCounts.equals(elementCounts);
        } else {
            return false;
        }
    }

    public String toString() {
        return hillString;
    }

    // Hill order: C first, H second, others alphabetically. Without carbon everything is alphabetical.
    private static String toHillString(Map<String, Integer> elementCounts) {
        Map<String, Integer> rest = new TreeMap<>(elementCounts);
        StringBuilder sb = new StringBuilder(elementCounts.size() * 3);
        if (rest.getOrDefault("C", 0) > 0) {
            appendElement(sb, "C", rest.remove("C"));
            if (rest.containsKey("H")) {
                appendElement(sb, "H", rest.remove("H"));
            }
        }
        for (Map.Entry<String, Integer> entry : rest.entrySet()) {
            appendElement(sb, entry.getKey(), entry.getValue());
        }
        return sb.toString();
    }

    private static void appendElement(StringBuilder sb, String symbol, int count) {
        if (count == 0) {
            return;
        }
        sb.append(symbol);
        if (count > 1) {
            sb.append(count);
        }
    }
}
