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

public class UnknownElementException extends CorrectionException {

    public final String symbol;

    public UnknownElementException(String symbol) {
        super(String.format(Locale.US, "Element %s is not in the isotope table.", symbol));
        this.symbol = symbol;
    }

    @Override
    public String kind() {
        return "UnknownElement";
    }
}
