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

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import com.amazon.omniad.algorithms.tree.IsolationTree;

/**
 * Builds trees one after the other on the calling thread.
 */
public class SequentialTreeBuildExecutor extends AbstractTreeBuildExecutor {

    @Override
    public List<IsolationTree> build(int numberOfTrees, IntFunction<IsolationTree> treeFactory) {
        Thread caller = Thread.currentThread();
        List<IsolationTree> trees = new ArrayList<>(numberOfTrees);
        for (int i = 0; i < numberOfTrees; i++) {
            checkNotInterrupted(caller);
            trees.add(treeFactory.apply(i));
        }
        return trees;
    }
}
