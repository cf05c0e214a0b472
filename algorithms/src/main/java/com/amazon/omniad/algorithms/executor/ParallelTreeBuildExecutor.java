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

import static com.amazon.omniad.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.amazon.omniad.algorithms.tree.IsolationTree;

/**
 * Builds trees in parallel on a private thread pool. The pool lives only for
 * the duration of one {@link #build} call.
 */
public class ParallelTreeBuildExecutor extends AbstractTreeBuildExecutor {

    private final int threadPoolSize;

    public ParallelTreeBuildExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be positive");
        this.threadPoolSize = threadPoolSize;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    public List<IsolationTree> build(int numberOfTrees, IntFunction<IsolationTree> treeFactory) {
        Thread caller = Thread.currentThread();
        checkNotInterrupted(caller);
        Callable<List<IsolationTree>> task = () -> IntStream.range(0, numberOfTrees).parallel().mapToObj(i -> {
            checkNotInterrupted(caller);
            return treeFactory.apply(i);
        }).collect(Collectors.toList());

        ForkJoinPool forkJoinPool = new ForkJoinPool(threadPoolSize);
        try {
            return forkJoinPool.submit(task).join();
        } finally {
            forkJoinPool.shutdown();
        }
    }
}
