/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.omniad.algorithms.isolationforest;

import static com.amazon.omniad.CommonUtils.checkArgument;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.IBackend;
import com.amazon.omniad.algorithms.executor.AbstractTreeBuildExecutor;
import com.amazon.omniad.algorithms.executor.ParallelTreeBuildExecutor;
import com.amazon.omniad.algorithms.executor.SequentialTreeBuildExecutor;
import com.amazon.omniad.algorithms.state.IsolationForestMapper;
import com.amazon.omniad.algorithms.state.IsolationForestState;
import com.amazon.omniad.algorithms.tree.IsolationTree;
import com.amazon.omniad.capability.IFeatureImportance;
import com.amazon.omniad.state.ProtostuffStateSerializer;

/**
 * Isolation Forest: an ensemble of random trees grown on subsamples of the
 * training data. Points that are isolated after few splits are anomalous.
 */
public class IsolationForestBackend implements IBackend<IsolationForestModel> {

    private static final Logger LOG = LogManager.getLogger(IsolationForestBackend.class);

    /**
     * Default number of trees.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default number of rows each tree is grown on.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Parallel tree building is off by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * Attribute holding the subsample size actually used, which is capped at
     * the number of training rows.
     */
    public static final String SAMPLE_SIZE_ATTRIBUTE = "forest.sampleSize";

    /**
     * Attribute holding the number of trees.
     */
    public static final String NUMBER_OF_TREES_ATTRIBUTE = "forest.numberOfTrees";

    private final int numberOfTrees;
    private final int sampleSize;
    private final Optional<Long> randomSeed;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;

    private final IsolationForestMapper mapper = new IsolationForestMapper();
    private final ProtostuffStateSerializer<IsolationForestState> serializer = new ProtostuffStateSerializer<>(
            IsolationForestState.class);

    protected IsolationForestBackend(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        this.numberOfTrees = builder.numberOfTrees;
        this.sampleSize = builder.sampleSize;
        this.randomSeed = builder.randomSeed;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize.orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        } else {
            threadPoolSize = 0;
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public Optional<Long> getRandomSeed() {
        return randomSeed;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    public IsolationForestModel fit(double[][] data, Attributes.Builder attributes) {
        long start = System.nanoTime();
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSampleSize, 2)) / Math.log(2));

        // seeds are drawn up front so that the forest does not depend on the
        // order in which trees are built
        Random random = randomSeed.map(Random::new).orElseGet(Random::new);
        long[] treeSeeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            treeSeeds[i] = random.nextLong();
        }

        AbstractTreeBuildExecutor executor = parallelExecutionEnabled ? new ParallelTreeBuildExecutor(threadPoolSize)
                : new SequentialTreeBuildExecutor();
        List<IsolationTree> trees = executor.build(numberOfTrees,
                i -> growTree(data, effectiveSampleSize, maxDepth, new Random(treeSeeds[i])));

        attributes.put(NUMBER_OF_TREES_ATTRIBUTE, numberOfTrees).put(SAMPLE_SIZE_ATTRIBUTE, effectiveSampleSize);
        if (LOG.isDebugEnabled()) {
            LOG.debug("grew {} trees of sample size {} in {} ms", numberOfTrees, effectiveSampleSize,
                    (System.nanoTime() - start) / 1_000_000);
        }
        return new IsolationForestModel(data[0].length, effectiveSampleSize, trees);
    }

    private static IsolationTree growTree(double[][] data, int sampleSize, int maxDepth, Random random) {
        int[] indexes = new int[data.length];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = i;
        }
        // partial Fisher-Yates shuffle, a sample without replacement
        for (int i = 0; i < sampleSize; i++) {
            int k = i + random.nextInt(indexes.length - i);
            int swap = indexes[i];
            indexes[i] = indexes[k];
            indexes[k] = swap;
        }
        int[] sample = new int[sampleSize];
        System.arraycopy(indexes, 0, sample, 0, sampleSize);
        return IsolationTree.grow(data, sample, maxDepth, random);
    }

    @Override
    public double[] score(IsolationForestModel model, Attributes attributes, double[][] data) {
        return model.score(data);
    }

    @Override
    public byte[] serialize(IsolationForestModel model) {
        return serializer.toBytes(mapper.toState(model));
    }

    @Override
    public IsolationForestModel deserialize(byte[] bytes) {
        return mapper.toModel(serializer.fromBytes(bytes));
    }

    @Override
    public <T> Optional<T> getCapability(Class<T> type, IsolationForestModel model, Attributes attributes) {
        if (type == IFeatureImportance.class) {
            return Optional.of(type.cast(model));
        }
        return Optional.empty();
    }

    public static class Builder<T extends Builder<T>> {

        // Optional for parameters whose default depends on other settings or on
        // the machine.

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public IsolationForestBackend build() {
            return new IsolationForestBackend(this);
        }
    }
}
