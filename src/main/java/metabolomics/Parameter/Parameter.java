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

package metabolomics.Parameter;

import metabolomics.Correction.CorrectionSolver;
import metabolomics.Correction.ResolutionModel;
import metabolomics.NACorr;
import metabolomics.Types.Isotope;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.*;

public class Parameter {

    private static final Pattern commentLinePattern = Pattern.compile("^#.*");
    private static final Pattern linePattern = Pattern.compile("([^#]+)=([^#]+)#*.*");
    private static final Pattern isotopePattern = Pattern.compile("(\\d+)\\s*:\\s*([0-9.eE\\-+]+)");
    private static final String defaultResource = "/nacorr.def";
    private static final String isotopePrefix = "isotope_";

    private Map<String, String> parameterMap = new LinkedHashMap<>();

    public Parameter(String parameterFile) throws IOException {
        this(new FileInputStream(parameterFile), parameterFile);
    }

    private Parameter(InputStream inputStream, String name) throws IOException {
        try (BufferedReader parameterReader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line = parameterReader.readLine();
            if (line == null) {
                throw new IOException(String.format(Locale.US, "The parameter file %s is empty.", name));
            }
            line = line.trim();
            if (!line.contentEquals("# " + NACorr.versionStr)) {
                throw new IOException(String.format(Locale.US, "The parameter file version (%s) is not compatible with current NACorr version (%s).", line.length() > 2 ? line.substring(2) : line, NACorr.versionStr));
            }
            while ((line = parameterReader.readLine()) != null) {
                line = line.trim();
                Matcher commentLineMatcher = commentLinePattern.matcher(line);
                if (!commentLineMatcher.matches()) {
                    // This is not a comment line
                    Matcher lineMatcher = linePattern.matcher(line);
                    if (lineMatcher.matches()) {
                        String parameterName = lineMatcher.group(1).trim();
                        String parameterValue = lineMatcher.group(2).trim();
                        parameterMap.put(parameterName, parameterValue);
                    }
                }
            }
        }
    }

    public static Parameter loadDefault() throws IOException {
        InputStream inputStream = Parameter.class.getResourceAsStream(defaultResource);
        if (inputStream == null) {
            throw new FileNotFoundException(String.format(Locale.US, "Cannot find %s on the classpath.", defaultResource));
        }
        return new Parameter(inputStream, defaultResource);
    }

    public Map<String, String> returnParameterMap() {
        return parameterMap;
    }

    public int getThreadNum() {
        return getInt("thread_num", 0);
    }

    public double getSingularityThreshold() {
        return getDouble("singularity_threshold", CorrectionSolver.DEFAULT_SINGULARITY_THRESHOLD);
    }

    public double getNegativeTolerance() {
        return getDouble("negative_tolerance", CorrectionSolver.DEFAULT_NEGATIVE_TOLERANCE);
    }

    public int getNnlsMaxIterations() {
        return getInt("nnls_max_iterations", 0);
    }

    // null means all elements
    public Set<String> getBackgroundElements() {
        String value = parameterMap.get("background_elements");
        if (value == null || value.trim().equalsIgnoreCase("all")) {
            return null;
        }
        Set<String> elementSet = new TreeSet<>();
        for (String temp : value.split(",")) {
            if (!temp.trim().isEmpty()) {
                elementSet.add(temp.trim());
            }
        }
        return elementSet;
    }

    // null unless a resolution is given
    public ResolutionModel getResolutionModel() {
        double resolution = getDouble("resolution", 0);
        if (resolution == 0) {
            return null;
        }
        String instrument = parameterMap.get("instrument");
        return new ResolutionModel(instrument == null ? ResolutionModel.Instrument.ORBITRAP : ResolutionModel.Instrument.parse(instrument), resolution, getDouble("resolution_mz", 200));
    }

    public Map<String, List<Isotope>> getIsotopeOverrides() {
        Map<String, List<Isotope>> overrideMap = new TreeMap<>();
        for (Map.Entry<String, String> entry : parameterMap.entrySet()) {
            if (!entry.getKey().startsWith(isotopePrefix)) {
                continue;
            }
            String symbol = entry.getKey().substring(isotopePrefix.length());
            List<Isotope> isotopeList = new ArrayList<>();
            for (String temp : entry.getValue().split(",")) {
                Matcher matcher = isotopePattern.matcher(temp.trim());
                if (!matcher.matches()) {
                    throw new IllegalArgumentException(String.format(Locale.US, "Cannot parse isotope %s of %s. Expected <mass number>:<abundance>.", temp.trim(), entry.getKey()));
                }
                isotopeList.add(new Isotope(Integer.valueOf(matcher.group(1)), Double.valueOf(matcher.group(2))));
            }
            overrideMap.put(symbol, isotopeList);
        }
        return overrideMap;
    }

    private int getInt(String name, int defaultValue) {
        String value = parameterMap.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(String.format(Locale.US, "Parameter %s = %s is not an integer.", name, value), ex);
        }
    }

    private double getDouble(String name, double defaultValue) {
        String value = parameterMap.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(String.format(Locale.US, "Parameter %s = %s is not a number.", name, value), ex);
        }
    }
}
