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

public class Isotope implements Comparable<Isotope> {

    public final int massNumber;
    public final double abundance;

    public Isotope(int massNumber, double abundance) {
        this.massNumber = massNumber;
        this.abundance = abundance;
    }

    public int compareTo(Isotope other) {
        return Integer.compare(massNumber, other.massNumber);
    }

    public int hashCode() {
        return 31 * massNumber + Double.hashCode(abundance);
    }

    public boolean equals(Object other) {
        if (other instanceof Isotope) {
            Isotope temp = (Isotope) other;
            return (temp.massNumber == massNumber) && (temp.abundance == abundance);
        } else {
            return false;
        }
    }

    public String toString() {
        return massNumber + ":" + abundance;
    }
}
