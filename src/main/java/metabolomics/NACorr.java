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

package metabolomics;

import metabolomics.Correction.CorrectionMatrixBuilder;
import metabolomics.Correction.CorrectionMatrixCache;
import metabolomics.Correction.CorrectionSolver;
import metabolomics.Correction.ResolutionModel;
import metabolomics.Exceptions.CorrectionException;
import metabolomics.Formula.FormulaParser;
import metabolomics.Formula.TracerResolver;
import metabolomics.Isotope.IsotopeTable;
import metabolomics.Parameter.Parameter;
import metabolomics.Types.CorrectionResult;
import metabolomics.Types.SampleGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Runs natural abundance correction over many (metabolite, sample) groups. Groups are independent, so each one is a
 * task in a fixed thread pool. Only the isotope table and the matrix cache are shared.
 */
public class NACorr {

    private static final Logger logger = LoggerFactory.getLogger(NACorr.class);
    public static final String versionStr = "1.0.0";

    private final FormulaParser formulaParser;
    private final TracerResolver tracerResolver;
    private final CorrectionMatrixCache matrixCache;
    private final CorrectionSolver solver;
    private final int threadNum;

    public NACorr(Parameter parameter) {
        logger.info("NACorr version {}.", versionStr);
        logger.info("Parameters:");
        Map<String, String> parameterMap = parameter.returnParameterMap();
        for (String k : parameterMap.keySet()) {
            logger.info("{} = {}", k, parameterMap.get(k));
        }

        IsotopeTable isotopeTable = IsotopeTable.defaultTable().withOverrides(parameter.getIsotopeOverrides());
        Set<String> backgroundElements = parameter.getBackgroundElements();
        ResolutionModel resolutionModel = parameter.getResolutionModel();
        if (resolutionModel != null) {
            logger.info("Natural abundance background is detected from the {}.", resolutionModel);
            if (backgroundElements != null) {
                logger.warn("background_elements = {} is ignored because a resolution is given.", backgroundElements);
            }
        } else if (backgroundElements != null) {
            logger.info("Natural abundance background is restricted to {}.", backgroundElements);
        }
        formulaParser = new FormulaParser(isotopeTable);
        tracerResolver = new TracerResolver(isotopeTable);
        matrixCache = new CorrectionMatrixCache(new CorrectionMatrixBuilder(isotopeTable, backgroundElements, resolutionModel));
        solver = new CorrectionSolver(parameter.getSingularityThreshold(), parameter.getNegativeTolerance(), parameter.getNnlsMaxIterations());

        int threadNum = parameter.getThreadNum();
        if (threadNum == 0) {
            threadNum = 3 + Runtime.getRuntime().availableProcessors();
        }
        this.threadNum = threadNum;
    }

    public NACorr(IsotopeTable isotopeTable, CorrectionMatrixCache matrixCache, CorrectionSolver solver, int threadNum) {
        formulaParser = new FormulaParser(isotopeTable);
        tracerResolver = new TracerResolver(isotopeTable);
        this.matrixCache = matrixCache;
        this.solver = solver;
        this.threadNum = threadNum;
    }

    public CorrectionResult correct(SampleGroup group) throws CorrectionException {
        return newTask(group).correct();
    }

    public BatchResult correctAll(List<SampleGroup> groupList) throws InterruptedException, ExecutionException {
        long startTime = System.nanoTime();
        logger.info("Correcting {} groups with {} threads...", groupList.size(), threadNum);

        ExecutorService threadPool = Executors.newFixedThreadPool(threadNum);
        List<NACorrWrap.Entry> entryList = new ArrayList<>(groupList.size());
        try {
            CompletionService<NACorrWrap.Entry> completionService = new ExecutorCompletionService<>(threadPool);
            for (SampleGroup group : groupList) {
                completionService.submit(newTask(group));
            }

            int lastProgress = 0;
            int totalCount = groupList.size();
            for (int count = 1; count <= totalCount; ++count) {
                NACorrWrap.Entry entry = completionService.take().get();
                if (!entry.isSuccess()) {
                    logger.warn("Skip {} ({}, tracer {}): {} {}", entry.group, entry.group.formula, entry.group.tracer, entry.failure.kind(), entry.failure.getMessage());
                }
                entryList.add(entry);

                int progress = count * 20 / totalCount;
                if (progress != lastProgress) {
                    logger.info("Correcting {}%...", progress * 5);
                    lastProgress = progress;
                }
            }
        } finally {
            // shutdown threads.
            threadPool.shutdown();
            if (!threadPool.awaitTermination(60, TimeUnit.SECONDS)) {
                threadPool.shutdownNow();
                if (!threadPool.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.error("Pool did not terminate.");
                }
            }
        }

        BatchResult batchResult = new BatchResult(entryList);
        logger.info("Corrected {} groups, skipped {}, built {} correction matrices in {} seconds.", batchResult.getSuccessList().size(), batchResult.getFailureList().size(), matrixCache.size(), (System.nanoTime() - startTime) * 1e-9);
        return batchResult;
    }

    public CorrectionMatrixCache getMatrixCache() {
        return matrixCache;
    }

    public int getThreadNum() {
        return threadNum;
    }

    private NACorrWrap newTask(SampleGroup group) {
        return new NACorrWrap(formulaParser, tracerResolver, matrixCache, solver, group);
    }

    public static class BatchResult {

        private final List<NACorrWrap.Entry> successList = new ArrayList<>();
        private final List<NACorrWrap.Entry> failureList = new ArrayList<>();

        BatchResult(List<NACorrWrap.Entry> entryList) {
            for (NACorrWrap.Entry entry : entryList) {
                if (entry.isSuccess()) {
                    successList.add(entry);
                } else {
                    failureList.add(entry);
                }
            }
        }

        public List<NACorrWrap.Entry> getSuccessList() {
            return Collections.unmodifiableList(successList);
        }

        public List<NACorrWrap.Entry> getFailureList() {
            return Collections.unmodifiableList(failureList);
        }

        // keyed by metabolite@sample
        public Map<String, CorrectionResult> getResultMap() {
            Map<String, CorrectionResult> resultMap = new LinkedHashMap<>();
            for (NACorrWrap.Entry entry : successList) {
                resultMap.put(entry.group.getId(), entry.result);
            }
            return resultMap;
        }
    }
}
