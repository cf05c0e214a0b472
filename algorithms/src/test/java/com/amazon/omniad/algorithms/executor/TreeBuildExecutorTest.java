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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.function.IntFunction;
import java.util.stream.Stream;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.omniad.algorithms.tree.IsolationTree;
import com.amazon.omniad.common.exception.FitCancelledException;

public class TreeBuildExecutorTest {

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(Arguments.of(new SequentialTreeBuildExecutor()),
                    Arguments.of(new ParallelTreeBuildExecutor(1)), Arguments.of(new ParallelTreeBuildExecutor(4)));
        }
    }

    private static IsolationTree leafWithMass(int mass) {
        return new IsolationTree(new int[] { IsolationTree.LEAF }, new double[1], new int[] { IsolationTree.LEAF },
                new int[] { IsolationTree.LEAF }, new int[] { mass });
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTreesAreOrderedByIndex(AbstractTreeBuildExecutor executor) {
        List<IsolationTree> trees = executor.build(50, TreeBuildExecutorTest::leafWithMass);

        assertEquals(50, trees.size());
        for (int i = 0; i < trees.size(); i++) {
            assertEquals(i, trees.get(i).getMass()[0]);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testFactoryCalledOncePerTree(AbstractTreeBuildExecutor executor) {
        @SuppressWarnings("unchecked")
        IntFunction<IsolationTree> factory = mock(IntFunction.class);
        when(factory.apply(anyInt())).thenReturn(leafWithMass(1));

        executor.build(7, factory);

        for (int i = 0; i < 7; i++) {
            verify(factory).apply(i);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testInterruptedCaller(AbstractTreeBuildExecutor executor) {
        @SuppressWarnings("unchecked")
        IntFunction<IsolationTree> factory = mock(IntFunction.class);
        Thread.currentThread().interrupt();
        try {
            assertThrows(FitCancelledException.class, () -> executor.build(10, factory));
            verifyNoInteractions(factory);
        } finally {
            // the flag is left for the caller to see; clear it for the next test
            assertTrue(Thread.interrupted());
        }
    }
}
