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

package metabolomics.Correction;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import metabolomics.Exceptions.InvalidTracerSpecException;
import metabolomics.Exceptions.UnknownElementException;
import metabolomics.Types.CorrectionMatrix;
import metabolomics.Types.Formula;
import metabolomics.Types.TracerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;

/**
 * Correction matrices keyed by (formula, tracer). The first caller of a key builds the matrix and publishes it,
 * concurrent callers of the same key wait for that result. Failed builds are not cached.
 */
public class CorrectionMatrixCache {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionMatrixCache.class);

    private final LoadingCache<MatrixKey, CorrectionMatrix> cache;

    public CorrectionMatrixCache(CorrectionMatrixBuilder builder) {
        cache = CacheBuilder.newBuilder().recordStats().build(new CacheLoader<MatrixKey, CorrectionMatrix>() {
            @Override
            public CorrectionMatrix load(MatrixKey key) throws Exception {
                logger.debug("Building the correction matrix of {} ({}).", key.formula, key.tracerSpec);
                CorrectionMatrix matrix = builder.build(key.formula, key.tracerSpec);
                logger.trace("{}", matrix);
                return matrix;
            }
        });
    }

    public CorrectionMatrix get(Formula formula, TracerSpec tracerSpec) throws UnknownElementException, InvalidTracerSpecException {
        try {
            return cache.get(new MatrixKey(formula, tracerSpec));
        } catch (ExecutionException | UncheckedExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof UnknownElementException) {
                throw (UnknownElementException) cause;
            } else if (cause instanceof InvalidTracerSpecException) {
                throw (InvalidTracerSpecException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new IllegalStateException("Unexpected failure while building a correction matrix.", cause);
            }
        }
    }

    public boolean contains(Formula formula, TracerSpec tracerSpec) {
        return cache.getIfPresent(new MatrixKey(formula, tracerSpec)) != null;
    }

    public long size() {
        return cache.size();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public void clear() {
        cache.invalidateAll();
    }

    private static class MatrixKey {

        final Formula formula;
        final TracerSpec tracerSpec;
        private final int hashCode;

        MatrixKey(Formula formula, TracerSpec tracerSpec) {
            this.formula = formula;
            this.tracerSpec = tracerSpec;
            hashCode = formula.hashCode() * 31 + tracerSpec.hashCode();
        }

        public int hashCode() {
            return hashCode;
        }

        public boolean equals(Object other) {
            if (other instanceof MatrixKey) {
                MatrixKey temp = (MatrixKey) other;
                return temp.formula.equals(formula) && temp.tracerSpec.equals(tracerSpec);
            } else {
                return false;
            }
        }
    }
}
