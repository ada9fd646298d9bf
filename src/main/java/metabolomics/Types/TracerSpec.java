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

import java.util.Locale;

/**
 * The labelled element, the mass number of its tracer isotope and the number of label states 0..maxLabelCount
 * that are observed.
 */
public class TracerSpec {

    public final String element;
    public final int labelMassNumber;
    public final int labelShift;
    public final int maxLabelCount;
    private final int hashCode;

    public TracerSpec(String element, int labelMassNumber, int labelShift, int maxLabelCount) {
        if (labelShift <= 0) {
            throw new IllegalArgumentException(String.format(Locale.US, "Tracer isotope %d%s is not heavier than the monoisotopic one.", labelMassNumber, element));
        }
        if (maxLabelCount < 0) {
            throw new IllegalArgumentException("Negative maximum label count " + maxLabelCount);
        }
        this.element = element;
        this.labelMassNumber = labelMassNumber;
        this.labelShift = labelShift;
        this.maxLabelCount = maxLabelCount;
        hashCode = toString().hashCode();
    }

    public int stateNum() {
        return maxLabelCount + 1;
    }

    public int hashCode() {
        return hashCode;
    }

    public boolean equals(Object other) {
        if (other instanceof TracerSpec) {
            TracerSpec temp = (TracerSpec) other;
            return temp.element.contentEquals(element) && (temp.labelMassNumber == labelMassNumber) && (temp.labelShift == labelShift) && (temp.maxLabelCount == maxLabelCount);
        } else {
            return false;
        }
    }

    public String toString() {
        return labelMassNumber + element + "x" + maxLabelCount;
    }
}
