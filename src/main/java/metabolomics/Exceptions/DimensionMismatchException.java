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

package metabolomics.Exceptions;

import java.util.Locale;

public class DimensionMismatchException extends CorrectionException {

    public final int expected;
    public final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format(Locale.US, "Expected %d intensities (label states 0..%d) but got %d.", expected, expected - 1, actual));
        this.expected = expected;
        this.actual = actual;
    }

    @Override
    public String kind() {
        return "DimensionMismatch";
    }
}
