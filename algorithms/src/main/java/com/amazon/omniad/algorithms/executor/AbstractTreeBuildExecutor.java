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

package com.amazon.omniad.algorithms.executor;

import java.util.List;
import java.util.function.IntFunction;

import com.amazon.omniad.algorithms.tree.IsolationTree;
import com.amazon.omniad.common.exception.FitCancelledException;

/**
 * Builds the trees of a forest. Tree {@code i} is produced by
 * {@code treeFactory.apply(i)}; the factory derives all randomness from the
 * index, so every executor yields the same forest.
 */
public abstract class AbstractTreeBuildExecutor {

    /**
     * @param numberOfTrees number of trees to build
     * @param treeFactory   builds the tree with the given index
     * @return the trees, ordered by index
     * @throws FitCancelledException if the calling thread is interrupted
     */
    public abstract List<IsolationTree> build(int numberOfTrees, IntFunction<IsolationTree> treeFactory);

    /**
     * Throws if {@code thread} has been interrupted. The interrupt flag is left
     * set so that callers further up can see it as well.
     */
    protected static void checkNotInterrupted(Thread thread) {
        if (thread.isInterrupted()) {
            throw new FitCancelledException("tree building was interrupted");
        }
    }
}
